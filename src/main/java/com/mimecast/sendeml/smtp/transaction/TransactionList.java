package com.mimecast.sendeml.smtp.transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Session transaction list.
 *
 * <p>Records every exchange of one connection in order.
 * <p>Owned by a single session and not shared between threads.
 */
public class TransactionList {

    /**
     * Transactions.
     */
    private final List<Transaction> transactions = new ArrayList<>();

    /**
     * Adds transaction.
     *
     * @param command  Command verb.
     * @param payload  Payload string.
     * @param response Response string.
     * @param error    Is error.
     */
    public void addTransaction(String command, String payload, String response, boolean error) {
        transactions.add(new Transaction(command, payload, response, error));
    }

    /**
     * Gets all transactions.
     *
     * @return Unmodifiable list of Transaction.
     */
    public List<Transaction> getTransactions() {
        return Collections.unmodifiableList(transactions);
    }

    /**
     * Gets transactions of given command.
     *
     * @param command Command verb.
     * @return List of Transaction.
     */
    public List<Transaction> getTransactions(String command) {
        List<Transaction> found = new ArrayList<>();
        for (Transaction transaction : transactions) {
            if (transaction.getCommand().equalsIgnoreCase(command)) {
                found.add(transaction);
            }
        }

        return found;
    }

    /**
     * Gets last transaction.
     *
     * @return Transaction instance or null if empty.
     */
    public Transaction getLast() {
        return !transactions.isEmpty() ? transactions.get(transactions.size() - 1) : null;
    }

    /**
     * Gets errors.
     *
     * @return List of Transaction.
     */
    public List<Transaction> getErrors() {
        List<Transaction> found = new ArrayList<>();
        for (Transaction transaction : transactions) {
            if (transaction.isError()) {
                found.add(transaction);
            }
        }

        return found;
    }
}
