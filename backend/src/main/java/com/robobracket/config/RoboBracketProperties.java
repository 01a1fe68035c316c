package com.robobracket.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Bracket and seeding behaviour switches.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "robobracket")
public class RoboBracketProperties {

    private Bracket bracket = new Bracket();
    private Seeding seeding = new Seeding();

    @Getter
    @Setter
    public static class Bracket {
        /**
         * Build each bracket template once per size and reuse it.
         */
        private boolean templateCacheEnabled = true;

        /**
         * Allows head referees to re-decide a completed game while its teams have not played again.
         */
        private boolean allowResultOverride = true;
    }

    @Getter
    @Setter
    public static class Seeding {
        /**
         * Append teams without a seeding score after the ranked teams when filling bracket entries.
         */
        private boolean includeUnrankedTeams = false;

        private int maxRounds = 3;
    }
}
