package org.talkpp.compiler.generator;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registry of services with a generated call stub. Lookup is by lower-cased service name.
 */
public enum ServiceStub {
    EMAIL("SendGrid",
          "email service call",
          "send_email_sendgrid",
          "email_result",
          "Sending email via SendGrid",
          "Failed to send email",
          "sendgrid"),
    SMS("Twilio",
        "SMS service call",
        "send_sms_twilio",
        "sms_result",
        "Sending SMS via Twilio",
        "Failed to send SMS",
        "twilio"),
    DATABASE("PostgreSQL",
             "database operation",
             "execute_postgres_query",
             "db_result",
             "Executing database operation",
             "Database operation failed",
             "postgresql", "postgres");

    private static final Map<String, ServiceStub> BY_NAME = Arrays.stream(values())
                                                                  .flatMap(stub -> Stream.of(stub.names)
                                                                                         .map(name -> Map.entry(name, stub)))
                                                                  .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey,
                                                                                                        Map.Entry::getValue));

    private final String provider;
    private final String description;
    private final String functionName;
    private final String resultName;
    private final String progressMessage;
    private final String failureMessage;
    private final String[] names;

    ServiceStub(String provider,
                String description,
                String functionName,
                String resultName,
                String progressMessage,
                String failureMessage,
                String... names) {
        this.provider = provider;
        this.description = description;
        this.functionName = functionName;
        this.resultName = resultName;
        this.progressMessage = progressMessage;
        this.failureMessage = failureMessage;
        this.names = names;
    }

    public static Optional<ServiceStub> forService(String serviceName) {
        return Optional.ofNullable(BY_NAME.get(serviceName.toLowerCase(Locale.ROOT)));
    }

    public String provider() {
        return provider;
    }

    /**
     * Heading comment placed above each invocation: "SendGrid email service call".
     */
    public String heading() {
        return provider + " " + description;
    }

    public String functionName() {
        return functionName;
    }

    public String camelFunctionName() {
        return camelCase(functionName);
    }

    public String resultName() {
        return resultName;
    }

    public String progressMessage() {
        return progressMessage;
    }

    public String failureMessage() {
        return failureMessage;
    }

    private static String camelCase(String snake) {
        var parts = snake.split("_");
        var sb = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            sb.append(Character.toUpperCase(parts[i].charAt(0)))
              .append(parts[i].substring(1));
        }
        return sb.toString();
    }
}
