package villagecompute.webapp.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * External authentication scheme offered on the manage-logins page.
 *
 * @param scheme
 *            scheme name, matched against {@link UserLoginInfoType#loginProvider()}
 * @param displayName
 *            label for the "link account" button
 */
public record AuthenticationSchemeType(String scheme, @JsonProperty("display_name") String displayName) {
}
