package net.miragecodex.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import net.miragecodex.config.CreditProperties;
import net.miragecodex.domain.credit.CreditBalance;
import net.miragecodex.domain.credit.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

class CreditLedgerRepositoryTest {

    private JdbcTemplate jdbcTemplate;
    private CreditLedgerRepository repository;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        repository = new CreditLedgerRepository(jdbcTemplate, new CreditProperties());
    }

    @Test
    void should_Throw_When_BalanceRowMissing() {
        when(jdbcTemplate.update(anyString(), any(), any())).thenReturn(0);

        assertThatThrownBy(() -> repository.applyBalanceDelta("ghost", -3))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    void should_ReturnGeneratedId_When_HoldInserted() {
        when(jdbcTemplate.queryForObject(contains("INSERT INTO credit_holds"), eq(Long.class), any(), any(), any()))
            .thenReturn(42L);

        assertThat(repository.insertHold("user-1", 5, "ref")).isEqualTo(42L);
    }

    @Test
    void should_StoreTypeCode_When_TransactionInserted() {
        repository.insertTransaction("user-1", -4, TransactionType.SEARCH, "Search", "{}");

        verify(jdbcTemplate).update(contains("INSERT INTO credit_transactions"), eq("user-1"), eq(-4), eq("search"),
            eq("Search"), eq("{}"));
    }

    @Test
    void should_ReportRemoval_When_HoldDeleted() {
        when(jdbcTemplate.update("DELETE FROM credit_holds WHERE id = ?", 8L)).thenReturn(1);

        assertThat(repository.deleteHold(8L)).isTrue();
        assertThat(repository.deleteHold(9L)).isFalse();
    }

    @Test
    void should_ReportCreation_When_AccountRowInserted() {
        when(jdbcTemplate.update(contains("INSERT INTO user_credits"), eq("new-user"))).thenReturn(1);
        when(jdbcTemplate.update(contains("INSERT INTO user_credits"), eq("old-user"))).thenReturn(0);

        assertThat(repository.ensureAccount("new-user")).isTrue();
        assertThat(repository.ensureAccount("old-user")).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void should_CountOnlyHoldsWithinTtl_When_ReadingBalance() {
        CreditProperties properties = new CreditProperties();
        properties.setHoldTtl(Duration.ofMinutes(10));
        repository = new CreditLedgerRepository(jdbcTemplate, properties);
        when(jdbcTemplate.query(contains("FROM user_credits"), any(ResultSetExtractor.class), eq("user-1")))
            .thenReturn(20);
        when(jdbcTemplate.queryForObject(contains("created_at > NOW()"), eq(Integer.class), eq("user-1"), eq(600L)))
            .thenReturn(5);

        assertThat(repository.findBalance("user-1")).contains(new CreditBalance("user-1", 20, 5));
    }

    @Test
    void should_DeleteHoldsOlderThanTtl_When_Sweeping() {
        when(jdbcTemplate.update(contains("DELETE FROM credit_holds WHERE created_at <="), eq(1800L))).thenReturn(2);

        assertThat(repository.deleteExpiredHolds()).isEqualTo(2);
    }
}
