package com.flagship.bridge_ledger.ledger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Named accounts the bridge books against.
 *
 * Sub-accounts identify who the account belongs to: the server's chain
 * account, the treasury account, the Lightning node or a customer.
 */
@Component
public class ChartOfAccounts {

    public static final String CUSTOMER_DEPOSITS_HIVE = "Customer Deposits Hive";
    public static final String TREASURY_HIVE = "Treasury Hive";
    public static final String TREASURY_LIGHTNING = "Treasury Lightning";
    public static final String CONVERTED_KEEPSATS_OFFSET = "Converted Keepsats Offset";
    public static final String EXCHANGE_CONVERSION_OFFSET = "Exchange Conversion Offset";
    public static final String CUSTOMER_LIABILITY = "Customer Liability";
    public static final String OWNER_LOAN_PAYABLE = "Owner Loan Payable (funding)";
    public static final String FEE_INCOME_KEEPSATS = "Fee Income Keepsats";
    public static final String FEE_INCOME_LIGHTNING = "Fee Income Lightning";
    public static final String ROUTING_FEE_INCOME = "Routing Fee Income";
    public static final String LIGHTNING_NETWORK_FEES = "Lightning Network Fees";

    private final String serverAccount;
    private final String treasuryAccount;
    private final String nodeName;

    public ChartOfAccounts(@Value("${bridge.server-account:v4vapp}") String serverAccount,
                           @Value("${bridge.treasury-account:v4vapp.tre}") String treasuryAccount,
                           @Value("${bridge.node-name:umbrel}") String nodeName) {
        this.serverAccount = serverAccount;
        this.treasuryAccount = treasuryAccount;
        this.nodeName = nodeName;
    }

    public String getServerAccount() {
        return serverAccount;
    }

    public String getTreasuryAccount() {
        return treasuryAccount;
    }

    public String getNodeName() {
        return nodeName;
    }

    public Account customerDepositsHive() {
        return Account.asset(CUSTOMER_DEPOSITS_HIVE, serverAccount);
    }

    public Account treasuryHive() {
        return Account.asset(TREASURY_HIVE, treasuryAccount);
    }

    public Account treasuryLightning() {
        return Account.asset(TREASURY_LIGHTNING, nodeName);
    }

    public Account convertedKeepsatsOffset() {
        return Account.asset(CONVERTED_KEEPSATS_OFFSET, serverAccount).asContra();
    }

    public Account exchangeConversionOffset() {
        return Account.asset(EXCHANGE_CONVERSION_OFFSET, serverAccount);
    }

    public Account customerLiability(String custId) {
        return Account.liability(CUSTOMER_LIABILITY, custId);
    }

    public Account ownerLoanPayable() {
        return Account.liability(OWNER_LOAN_PAYABLE, nodeName);
    }

    public Account keepsatsFeeIncome() {
        return Account.revenue(FEE_INCOME_KEEPSATS, serverAccount);
    }

    public Account lightningFeeIncome() {
        return Account.revenue(FEE_INCOME_LIGHTNING, nodeName);
    }

    public Account routingFeeIncome() {
        return Account.revenue(ROUTING_FEE_INCOME, nodeName);
    }

    public Account lightningNetworkFees() {
        return Account.expense(LIGHTNING_NETWORK_FEES, nodeName);
    }
}
