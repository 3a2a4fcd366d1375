package com.flagship.erp_ledger.common;

import com.flagship.erp_ledger.common.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Product line of an invoice or bill, with the quantity already returned against it.
 */
@MappedSuperclass
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class DocumentLine {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(name = "description")
    private String description;

    @Column(name = "quantity", nullable = false, precision = 15, scale = 2)
    private BigDecimal quantity;

    @Column(name = "price", nullable = false, precision = 15, scale = 2)
    private BigDecimal price;

    @Column(name = "amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "returned_quantity", nullable = false, precision = 15, scale = 2)
    private BigDecimal returnedQuantity;

    @Column(name = "line_number", nullable = false)
    private int lineNumber;

    protected DocumentLine(int lineNumber, UUID productId, String description, BigDecimal quantity, BigDecimal price) {
        if (!Money.isPositive(quantity)) {
            throw new ValidationException("Line " + lineNumber + ": quantity must be greater than zero");
        }
        if (price == null || Money.isNegative(price)) {
            throw new ValidationException("Line " + lineNumber + ": price must not be negative");
        }
        this.lineNumber = lineNumber;
        this.productId = productId;
        this.description = description;
        this.quantity = quantity;
        this.price = price;
        this.amount = DocumentTotals.lineAmount(quantity, price);
        this.returnedQuantity = Money.ZERO;
    }

    public BigDecimal getReturnableQuantity() {
        return quantity.subtract(returnedQuantity);
    }

    /**
     * @throws ValidationException when more would be returned than is left on the line
     */
    public void recordReturn(BigDecimal returned) {
        if (!Money.isPositive(returned)) {
            throw new ValidationException("Return quantity must be greater than zero");
        }
        if (returned.compareTo(getReturnableQuantity()) > 0) {
            throw new ValidationException(String.format(
                "Line %d: cannot return %s, only %s left to return", lineNumber, returned, getReturnableQuantity()));
        }
        this.returnedQuantity = returnedQuantity.add(returned);
    }
}
