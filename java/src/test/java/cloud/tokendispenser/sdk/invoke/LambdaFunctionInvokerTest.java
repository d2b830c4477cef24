package cloud.tokendispenser.sdk.invoke;

import cloud.tokendispenser.sdk.TransportException;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.lambda.AbstractAWSLambda;
import com.amazonaws.services.lambda.model.InvocationType;
import com.amazonaws.services.lambda.model.InvokeRequest;
import com.amazonaws.services.lambda.model.InvokeResult;
import com.amazonaws.services.lambda.model.ResourceNotFoundException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LambdaFunctionInvokerTest {

    @Test
    void invokesSynchronouslyWithPayload() throws Exception {
        List<InvokeRequest> requests = new ArrayList<>();
        LambdaFunctionInvoker invoker = new LambdaFunctionInvoker(new AbstractAWSLambda() {
            @Override
            public InvokeResult invoke(InvokeRequest request) {
                requests.add(request);
                return new InvokeResult()
                    .withStatusCode(200)
                    .withPayload(ByteBuffer.wrap("{\"result\": \"success\"}".getBytes(StandardCharsets.UTF_8)));
            }
        });

        InvocationResult result = invoker.call("test_lambda_arn",
            "{\"param\": \"value\"}".getBytes(StandardCharsets.UTF_8));

        assertEquals(200, result.statusCode());
        assertEquals("{\"result\": \"success\"}", result.body());
        assertNull(result.functionError());
        assertTrue(result.isSuccess());

        InvokeRequest request = requests.get(0);
        assertEquals("test_lambda_arn", request.getFunctionName());
        assertEquals(InvocationType.RequestResponse.toString(), request.getInvocationType());
        assertEquals("{\"param\": \"value\"}", StandardCharsets.UTF_8.decode(request.getPayload()).toString());
    }

    @Test
    void reportsFunctionError() throws Exception {
        LambdaFunctionInvoker invoker = new LambdaFunctionInvoker(new AbstractAWSLambda() {
            @Override
            public InvokeResult invoke(InvokeRequest request) {
                return new InvokeResult()
                    .withStatusCode(200)
                    .withFunctionError("Handled")
                    .withPayload(ByteBuffer.wrap("{\"error\": \"failure\"}".getBytes(StandardCharsets.UTF_8)));
            }
        });

        InvocationResult result = invoker.call("arn", new byte[0]);

        assertEquals("Handled", result.functionError());
        assertEquals("{\"error\": \"failure\"}", result.body());
        assertFalse(result.isSuccess());
    }

    @Test
    void missingPayloadBecomesEmptyBody() throws Exception {
        LambdaFunctionInvoker invoker = new LambdaFunctionInvoker(new AbstractAWSLambda() {
            @Override
            public InvokeResult invoke(InvokeRequest request) {
                return new InvokeResult().withStatusCode(200);
            }
        });

        assertEquals("", invoker.call("arn", new byte[0]).body());
    }

    @Test
    void serviceFaultsKeepTheirStatus() {
        LambdaFunctionInvoker invoker = new LambdaFunctionInvoker(new AbstractAWSLambda() {
            @Override
            public InvokeResult invoke(InvokeRequest request) {
                ResourceNotFoundException ex = new ResourceNotFoundException("Function not found: arn");
                ex.setStatusCode(404);
                throw ex;
            }
        });

        TransportException ex = assertThrows(TransportException.class, () -> invoker.call("arn", new byte[0]));
        assertEquals(404, ex.getStatusCode());
        assertTrue(ex.getMessage().contains("Function not found"));
        assertInstanceOf(AmazonServiceException.class, ex.getCause());
    }

    @Test
    void clientFaultsAreTransportExceptions() {
        LambdaFunctionInvoker invoker = new LambdaFunctionInvoker(new AbstractAWSLambda() {
            @Override
            public InvokeResult invoke(InvokeRequest request) {
                throw new SdkClientException("Unable to execute HTTP request: Read timed out");
            }
        });

        TransportException ex = assertThrows(TransportException.class, () -> invoker.call("arn", new byte[0]));
        assertEquals(-1, ex.getStatusCode());
        assertTrue(ex.getMessage().contains("Read timed out"));
    }
}
