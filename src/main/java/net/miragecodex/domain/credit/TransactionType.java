package net.miragecodex.domain.credit;

/**
 * Ledger transaction categories as stored in {@code credit_transactions.transaction_type}.
 */
public enum TransactionType {
    SEARCH("search"),
    PAGE_GENERATION("page_generation"),
    GRANT("grant"),
    ADJUSTMENT("adjustment");

    private final String code;

    TransactionType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
