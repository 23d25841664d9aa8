package com.mimecast.sendeml.main;

import com.mimecast.sendeml.smtp.SessionResult;
import com.mimecast.sendeml.smtp.session.SessionContext;
import com.mimecast.sendeml.smtp.transaction.Transaction;
import com.mimecast.sendeml.smtp.transaction.TransactionList;

import java.util.List;

/**
 * Outcome of one session run by {@link SessionRunner}.
 *
 * @param context      Session context the session ran in.
 * @param files        EML files handed to the session.
 * @param result       Session result, null if the session failed.
 * @param transactions Exchanges recorded before the session ended, null if no connection was made.
 * @param error        Error that ended the session, null on success.
 */
public record DeliveryResult(SessionContext context, List<String> files, SessionResult result,
                             TransactionList transactions, Exception error) {

    static DeliveryResult success(SessionContext context, List<String> files, SessionResult result, TransactionList transactions) {
        return new DeliveryResult(context, List.copyOf(files), result, transactions, null);
    }

    static DeliveryResult failure(SessionContext context, List<String> files, TransactionList transactions, Exception error) {
        return new DeliveryResult(context, List.copyOf(files), null, transactions, error);
    }

    /**
     * Is success.
     *
     * @return Boolean.
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Gets the last recorded exchange.
     *
     * @return Transaction instance or null if nothing was exchanged.
     */
    public Transaction lastTransaction() {
        return transactions != null ? transactions.getLast() : null;
    }

    /**
     * Gets a label naming the session for reports.
     *
     * @return Label string.
     */
    public String label() {
        return context.isParallel() ? String.join(", ", files) : context.toString();
    }
}
