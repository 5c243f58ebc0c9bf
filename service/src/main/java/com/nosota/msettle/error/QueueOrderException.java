package com.nosota.msettle.error;

/**
 * Execution attempted on a settlement that is not the queue head. Callers retry once earlier
 * settlements have left the queue.
 */
public class QueueOrderException extends SettlementException {
    public QueueOrderException(String message) {
        super(message);
    }
}
