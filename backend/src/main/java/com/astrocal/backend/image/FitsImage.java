package com.astrocal.backend.image;

import com.astrocal.backend.model.FrameHeader;
import lombok.Value;

@Value
public class FitsImage {
	FrameHeader header;
	ImageBuffer image;
}
