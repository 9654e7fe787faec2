/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.webapp.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;

/**
 * Site-wide configuration.
 *
 * <p>
 * Configuration prefix: {@code villagecompute.webapp}
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code villagecompute.webapp.base-url} - Public origin used to build absolute URLs (sitemap, canonical
 * links)</li>
 * <li>{@code villagecompute.webapp.site-name} - Display name rendered in page titles</li>
 * <li>{@code villagecompute.webapp.contact-email} - Address shown on the contact page</li>
 * <li>{@code villagecompute.webapp.external-login-schemes} - External login providers offered for account
 * linking</li>
 * <li>{@code villagecompute.webapp.two-factor-providers} - Providers able to deliver two-factor codes</li>
 * </ul>
 */
@ConfigMapping(
        prefix = "villagecompute.webapp")
public interface SiteConfig {

    /**
     * @return public origin, e.g. {@code https://www.example.com}
     */
    String baseUrl();

    @WithDefault("Village Webapp")
    String siteName();

    @WithDefault("hello@villagecompute.com")
    String contactEmail();

    @WithDefault("Google,Facebook,Apple")
    List<String> externalLoginSchemes();

    @WithDefault("Email,Phone")
    List<String> twoFactorProviders();
}
