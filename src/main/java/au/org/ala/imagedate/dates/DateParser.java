package au.org.ala.imagedate.dates;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Turns free text typed by a user into a point in time.
 */
@FunctionalInterface
public interface DateParser {

    /**
     * @return the parsed date, or empty if the text isn't understood
     */
    Optional<LocalDateTime> parse(String text);

}
