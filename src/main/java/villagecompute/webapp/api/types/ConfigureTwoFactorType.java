package villagecompute.webapp.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * View model for choosing the two-factor provider that delivers the verification code.
 *
 * @param selectedProvider
 *            provider picked by the user, {@code null} before submission
 * @param providers
 *            providers the user can choose from
 */
public record ConfigureTwoFactorType(@JsonProperty("selected_provider") String selectedProvider,
        List<SelectOptionType> providers) {

    public ConfigureTwoFactorType {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    /**
     * @return a copy of this model with {@code provider} selected
     */
    public ConfigureTwoFactorType withSelectedProvider(String provider) {
        return new ConfigureTwoFactorType(provider, providers);
    }
}
