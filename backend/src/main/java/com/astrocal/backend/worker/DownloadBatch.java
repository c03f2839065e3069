package com.astrocal.backend.worker;

import com.astrocal.backend.model.FrameRecord;
import com.astrocal.backend.model.RejectedFrame;
import lombok.Value;

import java.util.List;

/**
 * Frames fetched for one job, in input order. Files that failed to download are only reported
 * as warnings; files that downloaded but could not be decoded are rejected frames.
 */
@Value
public class DownloadBatch {
	List<FrameRecord> frames;
	List<RejectedFrame> unreadable;
	List<String> warnings;
}
