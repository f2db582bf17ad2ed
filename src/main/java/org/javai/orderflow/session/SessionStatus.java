package org.javai.orderflow.session;

public enum SessionStatus {
	ACTIVE,
	COMPLETED,
	TIMED_OUT
}
