package net.miragecodex.controller.dto;

import net.miragecodex.domain.credit.CreditBalance;

public record CreditBalanceDto(String userId, int balance, int available) {

    public static CreditBalanceDto fromBalance(CreditBalance balance) {
        return new CreditBalanceDto(balance.userId(), balance.balance(), balance.available());
    }
}
