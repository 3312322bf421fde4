package im.arun.jsonnav.search;

import im.arun.jsonnav.JsonNavException;
import lombok.Getter;

@Getter
public class InvalidPatternException extends JsonNavException {
    private final String pattern;

    public InvalidPatternException(String pattern, Throwable cause) {
        super("Invalid search pattern '" + pattern + "': " + cause.getMessage(), cause);
        this.pattern = pattern;
    }
}
