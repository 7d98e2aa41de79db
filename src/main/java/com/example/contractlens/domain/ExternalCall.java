package com.example.contractlens.domain;

/**
 * A member-access call whose receiver is a variable or a type cast, e.g.
 * {@code token.transfer(...)} or {@code IERC20(addr).transfer(...)}.
 */
public record ExternalCall(String contract, String function) {
    @Override
    public String toString() {
        return contract + "." + function;
    }
}
