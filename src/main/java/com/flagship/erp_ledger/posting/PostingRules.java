package com.flagship.erp_ledger.posting;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.ledger.PostingLine;
import com.flagship.erp_ledger.ledger.PostingRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

import static com.flagship.erp_ledger.posting.WellKnownAccount.ACCOUNTS_PAYABLE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.ACCOUNTS_RECEIVABLE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.ACCUMULATED_DEPRECIATION;
import static com.flagship.erp_ledger.posting.WellKnownAccount.DEPRECIATION_EXPENSE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.INVENTORY;
import static com.flagship.erp_ledger.posting.WellKnownAccount.OPERATING_EXPENSES;
import static com.flagship.erp_ledger.posting.WellKnownAccount.PAYROLL_LIABILITIES;
import static com.flagship.erp_ledger.posting.WellKnownAccount.SALARIES_EXPENSE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.SALES_REVENUE;
import static com.flagship.erp_ledger.posting.WellKnownAccount.VAT_PAYABLE;

/**
 * Turns business documents into balanced postings.
 *
 * Every rule resolves all the accounts it needs before building any line, so a missing mapping fails the
 * whole posting with a ConfigurationException.
 */
@Component
public class PostingRules {

    /**
     * Dr Accounts Receivable (total), Cr Sales Revenue (sub-total), Cr VAT Payable (VAT, when non-zero).
     * A zero-value invoice yields a request without lines.
     */
    public PostingRequest salesInvoice(DocumentRef ref, BigDecimal subTotal, BigDecimal vatAmount,
                                       BigDecimal totalAmount, PostingAccounts accounts) {
        UUID receivable = accounts.require(ACCOUNTS_RECEIVABLE);
        UUID revenue = accounts.require(SALES_REVENUE);
        UUID vat = Money.isPositive(vatAmount) ? accounts.require(VAT_PAYABLE) : null;

        String label = "Invoice " + ref.getDocumentNumber();
        PostingRequest.PostingRequestBuilder request = ref.toRequest(label);
        addLine(request, PostingLine.debit(receivable, totalAmount, label));
        addLine(request, PostingLine.credit(revenue, subTotal, label));
        if (vat != null) {
            request.line(PostingLine.credit(vat, vatAmount, "VAT for " + label));
        }
        return request.build();
    }

    /**
     * Dr Inventory (sub-total), Dr VAT Payable (VAT, when non-zero), Cr Accounts Payable (total).
     * A zero-value bill yields a request without lines.
     */
    public PostingRequest purchaseBill(DocumentRef ref, BigDecimal subTotal, BigDecimal vatAmount,
                                       BigDecimal totalAmount, PostingAccounts accounts) {
        UUID inventory = accounts.require(INVENTORY);
        UUID payable = accounts.require(ACCOUNTS_PAYABLE);
        UUID vat = Money.isPositive(vatAmount) ? accounts.require(VAT_PAYABLE) : null;

        String label = "Purchase Bill " + ref.getDocumentNumber();
        PostingRequest.PostingRequestBuilder request = ref.toRequest(label);
        addLine(request, PostingLine.debit(inventory, subTotal, label));
        if (vat != null) {
            request.line(PostingLine.debit(vat, vatAmount, "VAT for " + label));
        }
        addLine(request, PostingLine.credit(payable, totalAmount, label));
        return request.build();
    }

    public PostingRequest invoicePayment(DocumentRef ref, BigDecimal amount, UUID paymentAccountId,
                                         PostingAccounts accounts) {
        UUID receivable = accounts.require(ACCOUNTS_RECEIVABLE);
        String label = "Payment for Invoice " + ref.getDocumentNumber();
        return ref.toRequest(label)
            .line(PostingLine.debit(paymentAccountId, amount, label))
            .line(PostingLine.credit(receivable, amount, label))
            .build();
    }

    public PostingRequest billPayment(DocumentRef ref, BigDecimal amount, UUID paymentAccountId,
                                      PostingAccounts accounts) {
        UUID payable = accounts.require(ACCOUNTS_PAYABLE);
        String label = "Payment for Bill " + ref.getDocumentNumber();
        return ref.toRequest(label)
            .line(PostingLine.debit(payable, amount, label))
            .line(PostingLine.credit(paymentAccountId, amount, label))
            .build();
    }

    /**
     * Bad debt: Dr Operating Expenses, Cr Accounts Receivable for the unpaid remainder.
     */
    public PostingRequest invoiceWriteOff(DocumentRef ref, BigDecimal remaining, PostingAccounts accounts) {
        UUID expense = accounts.require(OPERATING_EXPENSES);
        UUID receivable = accounts.require(ACCOUNTS_RECEIVABLE);
        String label = "Bad debt write-off for Invoice " + ref.getDocumentNumber();
        return ref.toRequest(label)
            .line(PostingLine.debit(expense, remaining, label))
            .line(PostingLine.credit(receivable, remaining, label))
            .build();
    }

    /**
     * Sales return: Dr Sales Revenue, Cr Accounts Receivable for the returned value. Zero-value returns post nothing.
     */
    public PostingRequest creditNote(DocumentRef ref, String invoiceNumber, BigDecimal amount,
                                     PostingAccounts accounts) {
        UUID revenue = accounts.require(SALES_REVENUE);
        UUID receivable = accounts.require(ACCOUNTS_RECEIVABLE);
        String label = "Credit Note " + ref.getDocumentNumber() + " for Invoice " + invoiceNumber;
        PostingRequest.PostingRequestBuilder request = ref.toRequest(label);
        addLine(request, PostingLine.debit(revenue, amount, label));
        addLine(request, PostingLine.credit(receivable, amount, label));
        return request.build();
    }

    /**
     * Purchase return: Dr Accounts Payable, Cr Inventory for the returned value. Zero-value returns post nothing.
     */
    public PostingRequest debitNote(DocumentRef ref, String billNumber, BigDecimal amount,
                                    PostingAccounts accounts) {
        UUID payable = accounts.require(ACCOUNTS_PAYABLE);
        UUID inventory = accounts.require(INVENTORY);
        String label = "Debit Note " + ref.getDocumentNumber() + " for Bill " + billNumber;
        PostingRequest.PostingRequestBuilder request = ref.toRequest(label);
        addLine(request, PostingLine.debit(payable, amount, label));
        addLine(request, PostingLine.credit(inventory, amount, label));
        return request.build();
    }

    public PostingRequest fundTransfer(DocumentRef ref, UUID fromChartAccountId, String fromName,
                                       UUID toChartAccountId, String toName, BigDecimal amount,
                                       String description) {
        return ref.toRequest(description != null ? description : "Fund transfer " + ref.getDocumentNumber())
            .line(PostingLine.debit(toChartAccountId, amount, "Transfer from " + fromName))
            .line(PostingLine.credit(fromChartAccountId, amount, "Transfer to " + toName))
            .build();
    }

    public PostingRequest bankDeposit(DocumentRef ref, UUID bankChartAccountId, UUID counterAccountId,
                                      BigDecimal amount, String description) {
        return ref.toRequest(description)
            .line(PostingLine.debit(bankChartAccountId, amount, description))
            .line(PostingLine.credit(counterAccountId, amount, description))
            .build();
    }

    public PostingRequest bankWithdrawal(DocumentRef ref, UUID bankChartAccountId, UUID counterAccountId,
                                         BigDecimal amount, String description) {
        return ref.toRequest(description)
            .line(PostingLine.debit(counterAccountId, amount, description))
            .line(PostingLine.credit(bankChartAccountId, amount, description))
            .build();
    }

    public PostingRequest depreciation(DocumentRef ref, String assetName, BigDecimal amount,
                                       PostingAccounts accounts) {
        UUID expense = accounts.require(DEPRECIATION_EXPENSE);
        UUID accumulated = accounts.require(ACCUMULATED_DEPRECIATION);
        String label = "Depreciation of " + assetName;
        return ref.toRequest(label)
            .line(PostingLine.debit(expense, amount, label))
            .line(PostingLine.credit(accumulated, amount, label))
            .build();
    }

    /**
     * Dr Salaries Expense (gross), Cr payment account (net), Cr Payroll Liabilities (deductions, when non-zero).
     */
    public PostingRequest payslipPayment(DocumentRef ref, BigDecimal grossPay, BigDecimal netPay,
                                         BigDecimal totalDeductions, UUID paymentAccountId,
                                         PostingAccounts accounts) {
        UUID salaries = accounts.require(SALARIES_EXPENSE);
        UUID liabilities = Money.isPositive(totalDeductions) ? accounts.require(PAYROLL_LIABILITIES) : null;

        String label = "Salary payment " + ref.getDocumentNumber();
        PostingRequest.PostingRequestBuilder request = ref.toRequest(label)
            .line(PostingLine.debit(salaries, grossPay, label));
        if (Money.isPositive(netPay)) {
            request.line(PostingLine.credit(paymentAccountId, netPay, label));
        }
        if (liabilities != null) {
            request.line(PostingLine.credit(liabilities, totalDeductions, "Deductions withheld " + ref.getDocumentNumber()));
        }
        return request.build();
    }

    private static void addLine(PostingRequest.PostingRequestBuilder request, PostingLine line) {
        if (!line.isZero()) {
            request.line(line);
        }
    }
}
