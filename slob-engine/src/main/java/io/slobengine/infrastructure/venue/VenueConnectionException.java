package io.slobengine.infrastructure.venue;

/**
 * Exception thrown when the venue connection fails or is interrupted.
 */
public class VenueConnectionException extends RuntimeException {

    private final String venue;

    public VenueConnectionException(String venue, String message) {
        super(String.format("[%s] %s", venue, message));
        this.venue = venue;
    }

    public VenueConnectionException(String venue, String message, Throwable cause) {
        super(String.format("[%s] %s", venue, message), cause);
        this.venue = venue;
    }

    public String getVenue() {
        return venue;
    }
}
