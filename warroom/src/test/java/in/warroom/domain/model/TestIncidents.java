package in.warroom.domain.model;

import java.util.List;

/**
 * Incident fixtures shared by the tests.
 */
public final class TestIncidents {

    public static Incident billingWithFix() {
        return new Incident(
            "billing",
            "BILLING_400",
            "Missing required field: currency",
            List.of("POST /api/billing/charge 400", "Stripe: PaymentIntent requires currency", "Checkout abandoned"),
            "Billing service not receiving currency field after API contract change",
            "Add currency parameter to charge creation",
            "services/billing.py",
            "BillingAgent",
            new FixPatch("def charge(a):\n    pass\n", "def charge(a, currency='usd'):\n    pass\n")
        );
    }

    public static Incident databaseWithoutFix() {
        return new Incident(
            "database",
            "DB_POOL_EXHAUSTED",
            "Connection pool exhausted after 30s wait",
            List.of("Timeouts acquiring DB connection"),
            "Long-running reporting query holds connections during peak traffic",
            "Move reporting query to read replica and cap its pool",
            "services/reporting.py",
            "SREAgent",
            null
        );
    }

    private TestIncidents() {}
}
