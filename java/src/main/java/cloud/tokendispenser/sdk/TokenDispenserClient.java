package cloud.tokendispenser.sdk;

import cloud.tokendispenser.sdk.discovery.DiscoveryResolver;
import cloud.tokendispenser.sdk.discovery.ParameterDirectory;
import cloud.tokendispenser.sdk.discovery.SsmParameterDirectory;
import cloud.tokendispenser.sdk.invoke.FunctionInvoker;
import cloud.tokendispenser.sdk.invoke.HttpFunctionInvoker;
import cloud.tokendispenser.sdk.invoke.InvocationGateway;
import cloud.tokendispenser.sdk.invoke.LambdaFunctionInvoker;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.services.lambda.AWSLambda;
import com.amazonaws.services.lambda.AWSLambdaClientBuilder;
import com.amazonaws.services.simplesystemsmanagement.AWSSimpleSystemsManagement;
import com.amazonaws.services.simplesystemsmanagement.AWSSimpleSystemsManagementClientBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for obtaining tokens from the Token Dispenser Service (TDS). The dispenser caches tokens on the
 * server side, so repeated calls with the same client id reuse a token for as long as it stays alive for at least
 * {@code minimumAliveSecs}.
 * </p>
 *
 * <h2>Request flow</h2>
 * <ol>
 *   <li>Validates the client id and minimum alive interval. Invalid input never reaches the network.</li>
 *   <li>Resolves the dispenser identifier from the parameter directory: the explicit discovery key when given,
 *       otherwise the single entry below {@link Config#getDiscoveryPrefix()}.</li>
 *   <li>Invokes the dispenser once and returns its response body verbatim.</li>
 * </ol>
 *
 * <p>
 * The client keeps no per-call state and never retries. It is safe to share between threads as long as the
 * directory and invoker are.
 * </p>
 */
public final class TokenDispenserClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(TokenDispenserClient.class.getName());

    private final Config config;
    private final InputValidator validator;
    private final DiscoveryResolver resolver;
    private final InvocationGateway gateway;
    private final List<Runnable> shutdownHooks;

    /**
     * Constructs a client backed by AWS Systems Manager Parameter Store and, depending on
     * {@link Config#getInvocationMode()}, AWS Lambda or an HTTP function URL. AWS clients created here are shut down
     * by {@link #close()}.
     */
    public TokenDispenserClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.shutdownHooks = new ArrayList<>();

        ClientConfiguration awsConfig = new ClientConfiguration()
            .withRequestTimeout((int) this.config.getRequestTimeout().toMillis());

        AWSSimpleSystemsManagementClientBuilder ssmBuilder = AWSSimpleSystemsManagementClientBuilder.standard()
            .withClientConfiguration(awsConfig);
        if (this.config.getRegion() != null) {
            ssmBuilder.withRegion(this.config.getRegion());
        }
        AWSSimpleSystemsManagement ssm = ssmBuilder.build();
        shutdownHooks.add(ssm::shutdown);

        FunctionInvoker invoker;
        if (this.config.getInvocationMode() == Config.InvocationMode.HTTP) {
            invoker = new HttpFunctionInvoker(this.config.getHttpClient(), this.config.getRequestTimeout());
        } else {
            AWSLambdaClientBuilder lambdaBuilder = AWSLambdaClientBuilder.standard()
                .withClientConfiguration(awsConfig);
            if (this.config.getRegion() != null) {
                lambdaBuilder.withRegion(this.config.getRegion());
            }
            AWSLambda lambda = lambdaBuilder.build();
            shutdownHooks.add(lambda::shutdown);
            invoker = new LambdaFunctionInvoker(lambda);
        }

        this.validator = InputValidator.from(this.config);
        this.resolver = new DiscoveryResolver(new SsmParameterDirectory(ssm), this.config.getDiscoveryPrefix());
        this.gateway = new InvocationGateway(invoker);
    }

    /**
     * Constructs a client over caller-supplied collaborators. The caller keeps ownership of both; {@link #close()}
     * does not touch them.
     */
    public TokenDispenserClient(Config config, ParameterDirectory directory, FunctionInvoker invoker) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.validator = InputValidator.from(this.config);
        this.resolver = new DiscoveryResolver(directory, this.config.getDiscoveryPrefix());
        this.gateway = new InvocationGateway(invoker);
        this.shutdownHooks = List.of();
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Obtains a token using the default minimum alive interval and the default discovery prefix.
     *
     * @see #getToken(String, Integer, String)
     */
    public String getToken(String clientId) throws TokenDispenserException {
        return getToken(clientId, null, null);
    }

    /**
     * Obtains a token using the default discovery prefix.
     *
     * @see #getToken(String, Integer, String)
     */
    public String getToken(String clientId, Integer minimumAliveSecs) throws TokenDispenserException {
        return getToken(clientId, minimumAliveSecs, null);
    }

    /**
     * Obtains a token from the dispenser.
     *
     * @param clientId         caller defined client id, 3 to 32 alphanumeric characters.
     * @param minimumAliveSecs minimum remaining lifetime of the returned token; {@code null} uses
     *                         {@link Config#getDefaultMinimumAliveSecs()}. A cached token living shorter than this is
     *                         replaced by a freshly minted one on the server side.
     * @param discoveryKey     fully qualified directory key of the dispenser, or {@code null} to search the default
     *                         prefix. Required when more than one dispenser is registered below the prefix.
     * @return the dispenser response, a JSON document with the token and its {@code created_at}/{@code expired_at}
     * epoch timestamps, returned unparsed.
     * @throws ValidationException when the input is rejected.
     * @throws DiscoveryException  when zero or several dispensers are found.
     * @throws BackendException    when the dispenser rejects the request.
     * @throws TransportException  when the directory or the dispenser cannot be reached.
     */
    public String getToken(String clientId, Integer minimumAliveSecs, String discoveryKey)
        throws TokenDispenserException {

        TokenRequest request = validator.validate(clientId, minimumAliveSecs, discoveryKey);

        String identifier;
        try {
            identifier = resolver.resolve(request.discoveryKey());
        } catch (TokenDispenserException ex) {
            LOGGER.warning(() -> "[tds-client] discovery failed: " + ex.getMessage());
            throw ex;
        }

        String response = gateway.invoke(identifier, request);
        LOGGER.info(() -> "[tds-client] obtained token for client " + request.clientId());
        return response;
    }

    @Override
    public void close() {
        for (Runnable hook : shutdownHooks) {
            hook.run();
        }
    }
}
