package com.astrocal.backend.storage;

import lombok.Value;

@Value
public class StoredObject {
	/** Name relative to the listed prefix. */
	String name;
	long size;
}
