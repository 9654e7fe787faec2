package villagecompute.webapp.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * View model for the manage-logins page.
 *
 * @param currentLogins
 *            external logins already linked to the account
 * @param otherLogins
 *            configured schemes that are not linked yet
 * @param showRemoveButton
 *            false when removing a login would leave the account without any way to sign in
 */
public record ManageLoginsType(@JsonProperty("current_logins") List<UserLoginInfoType> currentLogins,
        @JsonProperty("other_logins") List<AuthenticationSchemeType> otherLogins,
        @JsonProperty("show_remove_button") boolean showRemoveButton) {

    public ManageLoginsType {
        currentLogins = currentLogins == null ? List.of() : List.copyOf(currentLogins);
        otherLogins = otherLogins == null ? List.of() : List.copyOf(otherLogins);
    }
}
