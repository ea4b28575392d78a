package com.meltwater.rxamqp;

/**
 * Used to report if processing of an {@link IncomingMessage} succeeded or not.
 */
public interface Acknowledger {

	/**
	 * Call to indicate that the message was processed.
	 */
	void ack();

	/**
	 * Call to indicate that processing of the message failed.
	 */
	void reject();

}
