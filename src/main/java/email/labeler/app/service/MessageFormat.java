package email.labeler.app.service;

/**
 * Gmail message fetch formats. MINIMAL returns ids and labels only. The pipeline always fetches
 * FULL, since classification needs the body; METADATA and MINIMAL are for other callers of
 * {@link GmailApiService}.
 */
public enum MessageFormat {
    FULL("full"),
    METADATA("metadata"),
    MINIMAL("minimal");

    private final String apiValue;

    MessageFormat(String apiValue) {
        this.apiValue = apiValue;
    }

    public String apiValue() {
        return apiValue;
    }
}
