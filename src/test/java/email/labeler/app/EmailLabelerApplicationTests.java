package email.labeler.app;

import email.labeler.app.model.CategoryConfigStore;
import email.labeler.app.model.ClassificationMode;
import email.labeler.app.model.ClassificationResult;
import email.labeler.app.model.Email;
import email.labeler.app.service.EmailClassifier;
import email.labeler.app.service.GmailApiService;
import email.labeler.app.service.MlClassifier;
import email.labeler.app.service.UnavailableMlClassifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class EmailLabelerApplicationTests {

    @MockBean
    private GmailApiService gmailApiService;

    @Autowired
    private CategoryConfigStore configStore;

    @Autowired
    private MlClassifier mlClassifier;

    @Autowired
    private EmailClassifier emailClassifier;

    @Test
    void contextLoads_WithTestCategories() {
        assertEquals(2, configStore.getCategories().size());
        assertEquals("Shopping & Orders", configStore.getCategories().get(0).getName());
        assertInstanceOf(UnavailableMlClassifier.class, mlClassifier);
    }

    @Test
    void classify_HybridWithoutMlProvider_ShouldFallBackToRules() {
        // Given
        Email email = Email.builder()
            .messageId("m1")
            .sender("Flipkart <offers@flipkart.com>")
            .subject("Big Billion Days Sale")
            .bodyText("Huge offers inside. Click to unsubscribe.")
            .build();

        // When
        ClassificationResult result = emailClassifier.classify(email, ClassificationMode.HYBRID);

        // Then
        assertEquals("Promotions & Marketing", result.getCategory());
        assertEquals("rule_based_high_confidence", result.getMethod().wireValue());
    }
}
