package villagecompute.webapp.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * API type for the member profile edit form.
 *
 * <p>
 * Passive data holder; constraints are enforced by Bean Validation when the type is bound to a request.
 *
 * @param id
 *            profile primary key
 * @param sex
 *            self-described sex, free text
 * @param dateOfBirth
 *            date of birth (must be in the past)
 * @param socialSecurity
 *            social security number in {@code 123-45-6789} format, optional
 * @param picFile
 *            stored file name of the profile picture, optional
 * @param lookingForJob
 *            whether the member is open to job offers
 */
public record ProfileType(@Positive Integer id, @Size(
        max = 32) String sex, @JsonProperty("date_of_birth") @NotNull @Past LocalDate dateOfBirth,
        @JsonProperty("social_security") @Pattern(
                regexp = "\\d{3}-\\d{2}-\\d{4}",
                message = "must use the 123-45-6789 format") String socialSecurity,
        @JsonProperty("pic_file") @Size(
                max = 255) String picFile,
        @JsonProperty("is_looking_for_job") boolean lookingForJob) {
}
