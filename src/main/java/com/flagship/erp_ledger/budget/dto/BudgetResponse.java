package com.flagship.erp_ledger.budget.dto;

import com.flagship.erp_ledger.budget.Budget;
import com.flagship.erp_ledger.budget.BudgetItem;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class BudgetResponse {
    UUID id;
    String name;
    int fiscalYear;
    String description;
    List<Item> items;

    public static BudgetResponse from(Budget budget) {
        return new BudgetResponse(budget.getId(), budget.getName(), budget.getFiscalYear(), budget.getDescription(),
            budget.getItems().stream().map(Item::from).toList());
    }

    @Value
    public static class Item {
        UUID id;
        UUID accountId;
        BigDecimal amount;
        Integer month;

        static Item from(BudgetItem item) {
            return new Item(item.getId(), item.getAccountId(), item.getAmount(), item.getMonth());
        }
    }
}
