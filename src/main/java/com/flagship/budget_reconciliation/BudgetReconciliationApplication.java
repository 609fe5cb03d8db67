package com.flagship.budget_reconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BudgetReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication.run(BudgetReconciliationApplication.class, args);
    }
}
