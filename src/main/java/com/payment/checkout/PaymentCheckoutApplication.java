package com.payment.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Payment Checkout ledger. Provides:
 * <ul>
 *   <li>The item catalog offered through the payment gateway</li>
 *   <li>Payment transactions and the items purchased with them</li>
 *   <li>A write-once log of failed gateway API calls</li>
 * </ul>
 * Gateway calls, HTTP views and migrations live outside this application.
 */
@SpringBootApplication
public class PaymentCheckoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentCheckoutApplication.class, args);
    }
}
