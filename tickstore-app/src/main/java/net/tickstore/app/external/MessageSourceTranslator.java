package net.tickstore.app.external;

import org.springframework.context.MessageSource;

import java.util.Locale;

/** Resolves keys against the application's {@code messages*.properties}. */
public class MessageSourceTranslator implements Translator {
    private final MessageSource messages;
    private final Locale locale;

    public MessageSourceTranslator(MessageSource messages, Locale locale) {
        this.messages = messages;
        this.locale = locale;
    }

    @Override
    public String translate(String key, Object... args) {
        return messages.getMessage(key, args, key, locale);
    }
}
