package it.unitn.ranges;

/**
 * A token of a range string that is neither one integer nor two integers joined by the range delimiter.
 */
public class MalformedTokenException extends IllegalArgumentException {

    private final String token;

    public MalformedTokenException(String token, Throwable cause) {
        super("malformed token '%s'".formatted(token), cause);
        this.token = token;
    }

    public String token() {
        return token;
    }

}
