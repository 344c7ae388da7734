package org.mark.httprange.download.struct;

public enum DownloadState {
	IDLE,
	PREPARING,
	DOWNLOADING,
	VERIFYING,
	COMPLETED,
	FAILED
}
