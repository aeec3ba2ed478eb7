package com.flagship.payroll_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PayrollLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PayrollLedgerApplication.class, args);
    }
}
