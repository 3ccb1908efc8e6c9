package com.flagship.bridge_ledger.ledger;

import com.flagship.bridge_ledger.error.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Transaction categories. The code is what gets stored; keep codes stable
 * and no longer than 10 characters.
 */
public enum LedgerType {
    UNSET("unset"),
    OPENING_BALANCE("open_bal"),
    FUNDING("funding"),
    ROUTING_FEE("r_fee"),
    EXCHANGE_CONVERSION("exc_conv"),
    EXCHANGE_FEES("exc_fee"),
    CONV_CUSTOMER("cust_conv", "Conversion"),
    CONV_HIVE_TO_KEEPSATS("h_conv_k"),
    CONV_KEEPSATS_TO_HIVE("k_conv_h"),
    WITHDRAW_HIVE("withdraw_h"),
    DEPOSIT_HIVE("deposit_h"),
    SUSPICIOUS("susp"),
    HOLD_KEEPSATS("hold_k"),
    RELEASE_KEEPSATS("release_k"),
    CUSTOM_JSON_TRANSFER("c_j_trans"),
    CUSTOM_JSON_FEE("c_j_fee"),
    CUSTOM_JSON_FEE_REFUND("c_j_fee_r"),
    RECEIVE_LIGHTNING("recv_l", "Receive"),
    WITHDRAW_LIGHTNING("withdraw_l", "Send"),
    DEPOSIT_LIGHTNING("deposit_l"),
    CONSUME_CUSTOMER_KEEPSATS("consume_k"),
    CONTRA_HIVE_TO_KEEPSATS("h_contra_k"),
    CONTRA_KEEPSATS_TO_HIVE("k_contra_h"),
    FEE_INCOME("fee_inc", "Fee"),
    FEE_EXPENSE("fee_exp"),
    EXPENSE("expense"),
    CUSTOMER_HIVE_IN("cust_h_in", "Deposit"),
    CUSTOMER_HIVE_OUT("cust_h_out", "Withdraw"),
    SERVER_TO_TREASURY("serv_to_t"),
    TREASURY_TO_SERVER("t_to_serv"),
    LIMIT_ORDER_CREATE("limit_or"),
    FILL_ORDER_SELL("fill_or_s"),
    FILL_ORDER_BUY("fill_or_b"),
    FILL_ORDER_NET("fill_or_n");

    private static final Map<String, LedgerType> BY_CODE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(LedgerType::getCode, Function.identity()));

    private final String code;
    private final String label;

    LedgerType(String code) {
        this(code, null);
    }

    LedgerType(String code, String label) {
        this.code = code;
        this.label = label != null ? label : capitalizeWords(name());
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static LedgerType fromCode(String code) {
        LedgerType type = BY_CODE.get(code);
        if (type == null) {
            throw new ValidationException("Unknown ledger type code: " + code);
        }
        return type;
    }

    private static String capitalizeWords(String constantName) {
        return Arrays.stream(constantName.toLowerCase(Locale.ROOT).split("_"))
            .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
            .collect(Collectors.joining(" "));
    }
}
