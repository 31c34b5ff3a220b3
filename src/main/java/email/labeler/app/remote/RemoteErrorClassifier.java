package email.labeler.app.remote;

import com.google.api.client.http.HttpResponseException;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLException;
import java.io.EOFException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * Maps exceptions raised by the Gmail client to an {@link ErrorKind}. Status codes come from
 * {@link HttpResponseException}, which Google's JSON error responses extend.
 */
@Component
public class RemoteErrorClassifier {

    public ErrorKind classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof HttpResponseException) {
                return classifyStatus((HttpResponseException) current);
            }
            if (current instanceof InterruptedIOException
                    || current instanceof ConnectException
                    || current instanceof SocketException
                    || current instanceof SSLException
                    || current instanceof EOFException
                    || current instanceof UnknownHostException) {
                return ErrorKind.TRANSIENT;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return ErrorKind.UNEXPECTED;
    }

    private ErrorKind classifyStatus(HttpResponseException e) {
        int status = e.getStatusCode();
        if (status == 429 || status >= 500) {
            return ErrorKind.TRANSIENT;
        }
        if (status == 404) {
            return ErrorKind.NOT_FOUND;
        }
        if (status == 409 || status == 412 || (status == 400 && isPreconditionFailure(e))) {
            return ErrorKind.CONFLICT;
        }
        return ErrorKind.UNEXPECTED;
    }

    private boolean isPreconditionFailure(HttpResponseException e) {
        String text = ((e.getContent() != null ? e.getContent() : "") + " " +
                (e.getMessage() != null ? e.getMessage() : "")).toLowerCase(Locale.ROOT);
        return text.contains("precondition check failed") || text.contains("failedprecondition");
    }
}
