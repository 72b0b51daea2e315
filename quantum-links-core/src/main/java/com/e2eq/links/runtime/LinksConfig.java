package com.e2eq.links.runtime;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

@StaticInitSafe
@ConfigMapping(prefix = "quantum.links")
public interface LinksConfig {

    Guard guard();

    Rules rules();

    Logging logging();

    Validation validation();

    interface Guard {
        /** Maximum nesting of workflow processing and of cascade plans. */
        @WithDefault("5")
        int maxDepth();

        /** Age after which a processing stack entry is considered abandoned. */
        @WithDefault("PT30S")
        Duration timeout();
    }

    interface Rules {
        /** Classpath resource, or file path, of the rule table. */
        @WithDefault("/link-rules.yaml")
        String location();
    }

    interface Logging {
        @WithDefault("true")
        boolean lifecycleEnabled();
    }

    interface Validation {
        /** Require both ends of a new link to exist in their repositories. */
        @WithDefault("false")
        boolean checkExistence();
    }
}
