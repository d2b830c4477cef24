package cloud.tokendispenser.sdk.discovery;

import cloud.tokendispenser.sdk.TransportException;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.simplesystemsmanagement.AWSSimpleSystemsManagement;
import com.amazonaws.services.simplesystemsmanagement.model.GetParameterRequest;
import com.amazonaws.services.simplesystemsmanagement.model.GetParameterResult;
import com.amazonaws.services.simplesystemsmanagement.model.GetParametersByPathRequest;
import com.amazonaws.services.simplesystemsmanagement.model.GetParametersByPathResult;
import com.amazonaws.services.simplesystemsmanagement.model.Parameter;
import com.amazonaws.services.simplesystemsmanagement.model.ParameterNotFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link ParameterDirectory} backed by AWS Systems Manager Parameter Store.
 */
public final class SsmParameterDirectory implements ParameterDirectory {

    private static final Logger LOGGER = Logger.getLogger(SsmParameterDirectory.class.getName());

    // GetParametersByPath accepts at most 10 results per page.
    private static final int MAX_PAGE_SIZE = 10;

    private final AWSSimpleSystemsManagement ssm;

    public SsmParameterDirectory(AWSSimpleSystemsManagement ssm) {
        this.ssm = Objects.requireNonNull(ssm, "ssm");
    }

    @Override
    public Optional<String> get(String path) throws TransportException {
        try {
            GetParameterResult result = ssm.getParameter(new GetParameterRequest().withName(path));
            if (result == null || result.getParameter() == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(result.getParameter().getValue());
        } catch (ParameterNotFoundException ex) {
            LOGGER.info(() -> "[tds-client] parameter not found: " + path);
            return Optional.empty();
        } catch (AmazonServiceException ex) {
            throw new TransportException("get parameter " + path + ": " + ex.getErrorMessage(), ex.getStatusCode(), ex);
        } catch (SdkClientException ex) {
            throw new TransportException("get parameter " + path + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public Map<String, String> listUnder(String prefix, int limit) throws TransportException {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        Map<String, String> entries = new LinkedHashMap<>();
        String nextToken = null;
        try {
            do {
                GetParametersByPathRequest request = new GetParametersByPathRequest()
                    .withPath(prefix)
                    .withRecursive(true)
                    .withMaxResults(Math.min(limit - entries.size(), MAX_PAGE_SIZE))
                    .withNextToken(nextToken);
                GetParametersByPathResult result = ssm.getParametersByPath(request);
                for (Parameter parameter : result.getParameters()) {
                    entries.put(parameter.getName(), parameter.getValue());
                    if (entries.size() >= limit) {
                        return entries;
                    }
                }
                nextToken = result.getNextToken();
            } while (nextToken != null && !nextToken.isEmpty());
        } catch (AmazonServiceException ex) {
            throw new TransportException("list parameters under " + prefix + ": " + ex.getErrorMessage(),
                ex.getStatusCode(), ex);
        } catch (SdkClientException ex) {
            throw new TransportException("list parameters under " + prefix + ": " + ex.getMessage(), ex);
        }
        return entries;
    }
}
