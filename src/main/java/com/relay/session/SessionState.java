package com.relay.session;

public enum SessionState {
	UNIDENTIFIED,
	IDENTIFIED,
	TERMINATED
}
