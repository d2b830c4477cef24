package cloud.tokendispenser.sdk.invoke;

import cloud.tokendispenser.sdk.TransportException;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Invoker stub answering with a fixed result and remembering the last call.
 */
public final class RecordingInvoker implements FunctionInvoker {

    private volatile InvocationResult result;
    private volatile TransportException failure;
    public volatile String lastIdentifier;
    public volatile String lastPayload;
    public final AtomicInteger calls = new AtomicInteger();

    public static RecordingInvoker answering(int status, String body) {
        RecordingInvoker invoker = new RecordingInvoker();
        invoker.result = InvocationResult.of(status, body);
        return invoker;
    }

    public static RecordingInvoker answering(InvocationResult result) {
        RecordingInvoker invoker = new RecordingInvoker();
        invoker.result = result;
        return invoker;
    }

    public static RecordingInvoker failingWith(TransportException failure) {
        RecordingInvoker invoker = new RecordingInvoker();
        invoker.failure = failure;
        return invoker;
    }

    @Override
    public InvocationResult call(String identifier, byte[] payload) throws TransportException {
        calls.incrementAndGet();
        lastIdentifier = identifier;
        lastPayload = new String(payload, StandardCharsets.UTF_8);
        if (failure != null) {
            throw failure;
        }
        return result;
    }
}
