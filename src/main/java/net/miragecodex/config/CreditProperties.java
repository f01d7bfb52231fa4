package net.miragecodex.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Credit account settings.
 */
@Component
@ConfigurationProperties(prefix = "miragecodex.credits")
public class CreditProperties {

    /**
     * Credits granted, as a ledger transaction, when a user's account is first opened.
     */
    private int starterCredits = 50;

    /**
     * Age after which a hold no longer reduces the available balance. Must exceed
     * the longest miss path (all generation attempts plus persistence).
     */
    private Duration holdTtl = Duration.ofMinutes(30);

    @PostConstruct
    void validate() {
        Assert.isTrue(starterCredits >= 0, "miragecodex.credits.starter-credits must be non-negative");
        Assert.isTrue(holdTtl != null && !holdTtl.isNegative() && !holdTtl.isZero(),
                "miragecodex.credits.hold-ttl must be positive");
    }

    public int getStarterCredits() {
        return starterCredits;
    }

    public void setStarterCredits(int starterCredits) {
        this.starterCredits = starterCredits;
    }

    public Duration getHoldTtl() {
        return holdTtl;
    }

    public void setHoldTtl(Duration holdTtl) {
        this.holdTtl = holdTtl;
    }
}
