package villagecompute.webapp.api.types;

/**
 * One {@code <option>} of an HTML select list.
 */
public record SelectOptionType(String text, String value) {
}
