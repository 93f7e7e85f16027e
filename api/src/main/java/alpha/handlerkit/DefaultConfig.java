package alpha.handlerkit;

import alpha.handlerkit.util.AbstractImmutableBuilder;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static alpha.handlerkit.HttpConstants.HeaderName.X_UA_COMPATIBLE;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder             builder;
    private final String              appId;
    private final boolean             production;
    private final List<String>        operatorEmails;
    private final String              mailFrom,
                                      mailFromName,
                                      operatorName,
                                      mailSubject;
    private final List<String>        errorMailTemplate;
    private final Map<String, String> compatibilityHeaders;

    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder              = b;
        appId                = s.appId;
        production           = s.production;
        operatorEmails       = s.operatorEmails;
        mailFrom             = s.mailFrom != null ? s.mailFrom : "errors@" + s.appId;
        mailFromName         = s.mailFromName;
        operatorName         = s.operatorName;
        mailSubject          = s.mailSubject;
        errorMailTemplate    = s.errorMailTemplate;
        compatibilityHeaders = s.compatibilityHeaders;
    }

    @Override
    public String appId() {
        return appId;
    }

    @Override
    public boolean production() {
        return production;
    }

    @Override
    public List<String> operatorEmails() {
        return operatorEmails;
    }

    @Override
    public String mailFrom() {
        return mailFrom;
    }

    @Override
    public String mailFromName() {
        return mailFromName;
    }

    @Override
    public String operatorName() {
        return operatorName;
    }

    @Override
    public String mailSubject() {
        return mailSubject;
    }

    @Override
    public List<String> errorMailTemplate() {
        return errorMailTemplate;
    }

    @Override
    public Map<String, String> compatibilityHeaders() {
        return compatibilityHeaders;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return "DefaultConfig{" +
                "appId=" + appId +
                ", production=" + production +
                ", operatorEmails=" + operatorEmails +
                ", mailFrom=" + mailFrom + '}';
    }

    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();

        static class MutableState {
            String              appId                = "app";
            boolean             production           = false;
            List<String>        operatorEmails       = List.of();
            // null = derived from appId
            String              mailFrom             = null,
                                mailFromName         = "Error Notifications",
                                operatorName         = "Administrator",
                                mailSubject          = "An error occurred in the application";
            List<String>        errorMailTemplate    = List.of("mails/error");
            Map<String, String> compatibilityHeaders = Map.of(X_UA_COMPATIBLE, "chrome=1");
        }

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Builder appId(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.appId = newVal);
        }

        @Override
        public Builder production(boolean newVal) {
            return new DefaultBuilder(this, s -> s.production = newVal);
        }

        @Override
        public Builder operatorEmails(List<String> newVal) {
            var copy = List.copyOf(newVal);
            return new DefaultBuilder(this, s -> s.operatorEmails = copy);
        }

        @Override
        public Builder mailFrom(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.mailFrom = newVal);
        }

        @Override
        public Builder mailFromName(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.mailFromName = newVal);
        }

        @Override
        public Builder operatorName(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.operatorName = newVal);
        }

        @Override
        public Builder mailSubject(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.mailSubject = newVal);
        }

        @Override
        public Builder errorMailTemplate(List<String> newVal) {
            var copy = List.copyOf(newVal);
            if (copy.isEmpty()) {
                throw new IllegalArgumentException("No template names.");
            }
            return new DefaultBuilder(this, s -> s.errorMailTemplate = copy);
        }

        @Override
        public Builder compatibilityHeaders(Map<String, String> newVal) {
            var copy = Map.copyOf(newVal);
            return new DefaultBuilder(this, s -> s.compatibilityHeaders = copy);
        }

        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
