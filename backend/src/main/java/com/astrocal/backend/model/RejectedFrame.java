package com.astrocal.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RejectedFrame {
	private String file;
	private List<String> warnings = new ArrayList<>();
	private String reason;

	public static RejectedFrame withWarnings(String file, List<String> warnings) {
		return new RejectedFrame(file, new ArrayList<>(warnings), null);
	}

	public static RejectedFrame withReason(String file, String reason) {
		return new RejectedFrame(file, new ArrayList<>(), reason);
	}
}
