package villagecompute.webapp.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.webapp.api.types.AuthenticationSchemeType;
import villagecompute.webapp.api.types.ConfigureTwoFactorType;
import villagecompute.webapp.api.types.ManageLoginsType;
import villagecompute.webapp.api.types.SelectOptionType;
import villagecompute.webapp.api.types.UserLoginInfoType;
import villagecompute.webapp.config.SiteConfig;
import villagecompute.webapp.exceptions.ValidationException;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the view models of the account management pages.
 *
 * <p>
 * Account state (linked logins, password, valid two-factor providers) comes from the identity provider; this service
 * only combines it with the providers enabled in {@link SiteConfig}.
 */
@ApplicationScoped
public class AccountManageService {

    private static final Logger LOG = Logger.getLogger(AccountManageService.class);

    @Inject
    SiteConfig siteConfig;

    /**
     * Builds the manage-logins view model.
     *
     * <p>
     * Schemes already linked to the account are not offered again. The remove button is hidden when the only way to
     * sign in is the single linked login.
     *
     * @param currentLogins
     *            external logins linked to the account
     * @param hasPassword
     *            whether the account also has a local password
     * @return view model
     */
    public ManageLoginsType buildManageLogins(List<UserLoginInfoType> currentLogins, boolean hasPassword) {
        List<UserLoginInfoType> logins = currentLogins == null ? List.of() : currentLogins;
        Set<String> linkedProviders = logins.stream().map(UserLoginInfoType::loginProvider)
                .collect(Collectors.toSet());

        List<AuthenticationSchemeType> otherLogins = siteConfig.externalLoginSchemes().stream()
                .filter(scheme -> !linkedProviders.contains(scheme))
                .map(scheme -> new AuthenticationSchemeType(scheme, scheme)).toList();

        boolean showRemoveButton = hasPassword || logins.size() > 1;
        return new ManageLoginsType(logins, otherLogins, showRemoveButton);
    }

    /**
     * Builds the two-factor provider selection.
     *
     * @param validProviders
     *            providers the account can receive codes with
     * @return view model listing the configured providers the account can use, in configuration order
     * @throws ValidationException
     *             if none of the configured providers is usable
     */
    public ConfigureTwoFactorType buildConfigureTwoFactor(Collection<String> validProviders) {
        Set<String> usable = validProviders == null ? Set.of() : Set.copyOf(validProviders);

        List<SelectOptionType> providers = siteConfig.twoFactorProviders().stream().filter(usable::contains)
                .map(provider -> new SelectOptionType(provider, provider)).toList();

        if (providers.isEmpty()) {
            LOG.infof("No usable two-factor provider (account providers: %s)", usable);
            throw new ValidationException("No two-factor provider is available for this account");
        }
        return new ConfigureTwoFactorType(null, providers);
    }

    /**
     * Validates a submitted provider selection.
     *
     * @param model
     *            submitted view model
     * @return the selected provider
     * @throws ValidationException
     *             if nothing was selected or the selection is not one of the offered providers
     */
    public String selectTwoFactorProvider(ConfigureTwoFactorType model) {
        String selected = model == null ? null : model.selectedProvider();
        if (selected == null || selected.isBlank()) {
            throw new ValidationException("A two-factor provider must be selected");
        }
        boolean offered = model.providers().stream().anyMatch(option -> selected.equals(option.value()));
        if (!offered || !siteConfig.twoFactorProviders().contains(selected)) {
            throw new ValidationException("Unknown two-factor provider: " + selected);
        }
        return selected;
    }
}
