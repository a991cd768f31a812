package com.conciliator.engine.services.statements.model;

import java.util.List;
import java.util.Optional;

import com.conciliator.engine.services.statements.classification.AccountResolution;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Output of one engine run. The caller decides whether to persist the ledger or the profile update.
 */
@Getter
@Builder
public class StatementResult {

    @Singular
    private final List<Transaction> transactions;

    private final StatementSummary summary;

    @Singular
    private final List<MatchResult> matches;

    private final ParseDiagnostics diagnostics;
    private final AccountResolution account;

    public Optional<AccountProfileUpdate> getProfileUpdate() {
        return account == null ? Optional.empty() : Optional.ofNullable(account.profileUpdate());
    }
}
