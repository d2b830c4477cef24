package cloud.tokendispenser.sdk.invoke;

import cloud.tokendispenser.sdk.TransportException;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.lambda.AWSLambda;
import com.amazonaws.services.lambda.model.InvocationType;
import com.amazonaws.services.lambda.model.InvokeRequest;
import com.amazonaws.services.lambda.model.InvokeResult;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link FunctionInvoker} performing synchronous ({@code RequestResponse}) AWS Lambda invocations.
 */
public final class LambdaFunctionInvoker implements FunctionInvoker {

    private final AWSLambda lambda;

    public LambdaFunctionInvoker(AWSLambda lambda) {
        this.lambda = Objects.requireNonNull(lambda, "lambda");
    }

    @Override
    public InvocationResult call(String identifier, byte[] payload) throws TransportException {
        InvokeRequest request = new InvokeRequest()
            .withFunctionName(identifier)
            .withInvocationType(InvocationType.RequestResponse)
            .withPayload(ByteBuffer.wrap(payload));

        InvokeResult result;
        try {
            result = lambda.invoke(request);
        } catch (AmazonServiceException ex) {
            throw new TransportException("invoke " + identifier + ": " + ex.getErrorMessage(), ex.getStatusCode(), ex);
        } catch (SdkClientException ex) {
            throw new TransportException("invoke " + identifier + ": " + ex.getMessage(), ex);
        }

        int status = result.getStatusCode() == null ? 200 : result.getStatusCode();
        return new InvocationResult(status, decode(result.getPayload()), result.getFunctionError());
    }

    private static String decode(ByteBuffer payload) {
        if (payload == null) {
            return "";
        }
        ByteBuffer copy = payload.asReadOnlyBuffer();
        byte[] bytes = new byte[copy.remaining()];
        copy.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
