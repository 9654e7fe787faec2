package villagecompute.webapp.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * External login linked to a local account.
 *
 * @param loginProvider
 *            authentication scheme name (e.g., "Google")
 * @param providerKey
 *            subject identifier issued by the provider
 * @param providerDisplayName
 *            human readable provider name
 */
public record UserLoginInfoType(@JsonProperty("login_provider") @NotBlank String loginProvider,
        @JsonProperty("provider_key") @NotBlank String providerKey,
        @JsonProperty("provider_display_name") String providerDisplayName) {
}
