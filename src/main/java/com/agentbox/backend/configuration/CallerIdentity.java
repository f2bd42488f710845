package com.agentbox.backend.configuration;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.security.Principal;

/**
 * Authenticated caller: either the operator or a wallet public key.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class CallerIdentity implements Principal {
    public static final String OPERATOR = "operator";

    private final boolean operator;
    private final String wallet;
    private final boolean admin;

    public static CallerIdentity operator() {
        return new CallerIdentity(true, null, true);
    }

    public static CallerIdentity wallet(String wallet, boolean admin) {
        return new CallerIdentity(false, wallet, admin);
    }

    @Override
    public String getName() {
        return operator ? OPERATOR : wallet;
    }

    public String actorType() {
        return operator ? "operator" : "wallet";
    }
}
