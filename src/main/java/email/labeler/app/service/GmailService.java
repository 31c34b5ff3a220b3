package email.labeler.app.service;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.BatchModifyMessagesRequest;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import email.labeler.app.model.Email;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class GmailService implements GmailApiService {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final long MAX_PAGE_SIZE = 500;

    private final NetHttpTransport httpTransport;
    private final String accessToken;
    private final String userId;
    private final String applicationName;
    private volatile Gmail gmail;

    public GmailService(@Value("${gmail.access-token:}") String accessToken,
                        @Value("${gmail.user-id:me}") String userId,
                        @Value("${gmail.application-name:Email Labeler}") String applicationName) throws Exception {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        this.accessToken = accessToken;
        this.userId = userId;
        this.applicationName = applicationName;

        if (accessToken == null || accessToken.isEmpty()) {
            log.warn("Gmail access token not configured. Set gmail.access-token before running the pipeline.");
        }
    }

    Gmail getGmailService() {
        Gmail service = gmail;
        if (service == null) {
            synchronized (this) {
                if (gmail == null) {
                    Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                        .setTransport(httpTransport)
                        .setJsonFactory(JSON_FACTORY)
                        .build();
                    credential.setAccessToken(accessToken);

                    gmail = new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
                        .setApplicationName(applicationName)
                        .build();
                }
                service = gmail;
            }
        }
        return service;
    }

    @Override
    public List<String> search(String query, Integer maxResults) throws Exception {
        List<String> messageIds = new ArrayList<>();
        String pageToken = null;

        do {
            long pageSize = MAX_PAGE_SIZE;
            if (maxResults != null) {
                int remaining = maxResults - messageIds.size();
                if (remaining <= 0) {
                    break;
                }
                pageSize = Math.min(remaining, MAX_PAGE_SIZE);
            }

            ListMessagesResponse response = getGmailService().users().messages().list(userId)
                .setQ(query)
                .setMaxResults(pageSize)
                .setPageToken(pageToken)
                .execute();

            if (response.getMessages() != null) {
                for (Message messageRef : response.getMessages()) {
                    messageIds.add(messageRef.getId());
                }
            }
            pageToken = response.getNextPageToken();
        } while (pageToken != null);

        log.info("Found {} messages for query: '{}'", messageIds.size(), query);
        if (maxResults != null && messageIds.size() > maxResults) {
            return messageIds.subList(0, maxResults);
        }
        return messageIds;
    }

    @Override
    public Email getMessage(String messageId, MessageFormat format) throws Exception {
        Message message = getGmailService().users().messages().get(userId, messageId)
            .setFormat(format.apiValue())
            .execute();
        return toEmail(message);
    }

    @Override
    public Map<String, String> getLabels() throws Exception {
        ListLabelsResponse response = getGmailService().users().labels().list(userId).execute();
        Map<String, String> labels = new LinkedHashMap<>();
        if (response.getLabels() != null) {
            for (Label label : response.getLabels()) {
                labels.put(label.getName(), label.getId());
            }
        }
        return labels;
    }

    @Override
    public String createLabel(String name) throws Exception {
        Label label = new Label()
            .setName(name)
            .setLabelListVisibility("labelShow")
            .setMessageListVisibility("show");
        Label created = getGmailService().users().labels().create(userId, label).execute();
        log.info("Created label '{}' with ID: {}", name, created.getId());
        return created.getId();
    }

    @Override
    public void addLabel(String messageId, String labelId) throws Exception {
        ModifyMessageRequest mods = new ModifyMessageRequest()
            .setAddLabelIds(Collections.singletonList(labelId))
            .setRemoveLabelIds(Collections.emptyList());

        getGmailService().users().messages().modify(userId, messageId, mods).execute();
    }

    @Override
    public void batchModify(List<String> messageIds, List<String> addLabelIds, List<String> removeLabelIds) throws Exception {
        if (messageIds.size() > MAX_BATCH_MODIFY_IDS) {
            throw new IllegalArgumentException("Batch modify accepts at most " + MAX_BATCH_MODIFY_IDS
                    + " ids, got " + messageIds.size());
        }
        BatchModifyMessagesRequest request = new BatchModifyMessagesRequest()
            .setIds(messageIds)
            .setAddLabelIds(addLabelIds)
            .setRemoveLabelIds(removeLabelIds);

        getGmailService().users().messages().batchModify(userId, request).execute();
    }

    Email toEmail(Message message) {
        String subject = "";
        String from = "";
        List<String> recipients = new ArrayList<>();

        MessagePart payload = message.getPayload();
        if (payload != null && payload.getHeaders() != null) {
            for (MessagePartHeader header : payload.getHeaders()) {
                String value = header.getValue() != null ? header.getValue() : "";
                switch (header.getName().toLowerCase()) {
                    case "subject":
                        subject = value;
                        break;
                    case "from":
                        from = value;
                        break;
                    case "to":
                    case "cc":
                        recipients.addAll(parseAddressList(value));
                        break;
                    default:
                        break;
                }
            }
        }

        String body = "";
        if (payload != null) {
            BodyExtractionResult bodyResult = extractBodyFromParts(payload);
            body = bodyResult.plainTextContent != null && !bodyResult.plainTextContent.isEmpty()
                ? bodyResult.plainTextContent
                : (bodyResult.htmlContent != null ? bodyResult.htmlContent : "");
        }

        return Email.builder()
            .messageId(message.getId())
            .threadId(message.getThreadId())
            .sender(from)
            .recipients(recipients)
            .subject(subject)
            .snippet(message.getSnippet() != null ? message.getSnippet() : "")
            .bodyText(body)
            .labelIds(message.getLabelIds() != null ? List.copyOf(message.getLabelIds()) : List.of())
            .receivedAt(message.getInternalDate() != null ? Instant.ofEpochMilli(message.getInternalDate()) : null)
            .build();
    }

    private static List<String> parseAddressList(String addresses) {
        if (addresses.isBlank()) {
            return List.of();
        }
        return Arrays.stream(addresses.split(","))
            .map(String::trim)
            .filter(address -> !address.isEmpty())
            .collect(Collectors.toList());
    }

    /** Plain text and HTML bodies collected across all parts. */
    private static class BodyExtractionResult {
        String htmlContent = null;
        String plainTextContent = null;
    }

    private BodyExtractionResult extractBodyFromParts(MessagePart part) {
        BodyExtractionResult result = new BodyExtractionResult();

        if (part.getBody() != null && part.getBody().getData() != null) {
            String mimeType = part.getMimeType();
            if ("text/plain".equals(mimeType) || "text/html".equals(mimeType)) {
                String decodedText = decodeBody(part.getBody().getData(), mimeType);
                if ("text/html".equals(mimeType)) {
                    result.htmlContent = decodedText;
                } else {
                    result.plainTextContent = decodedText;
                }
            }
        }

        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                BodyExtractionResult subResult = extractBodyFromParts(subPart);
                if (subResult.htmlContent != null && !subResult.htmlContent.isEmpty()) {
                    result.htmlContent = (result.htmlContent != null ? result.htmlContent + "\n" : "") + subResult.htmlContent;
                }
                if (subResult.plainTextContent != null && !subResult.plainTextContent.isEmpty()) {
                    result.plainTextContent = (result.plainTextContent != null ? result.plainTextContent + "\n" : "") + subResult.plainTextContent;
                }
            }
        }

        return result;
    }

    private String decodeBody(String data, String mimeType) {
        // Gmail uses URL-safe Base64; fall back to padded standard Base64
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            try {
                String paddedData = data;
                int remainder = paddedData.length() % 4;
                if (remainder > 0) {
                    paddedData += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(paddedData), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Error decoding email body part (mimeType: {}): {}", mimeType, e2.getMessage());
                return null;
            }
        }
    }
}
