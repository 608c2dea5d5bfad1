package com.gdin.inspection.cognify.util;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import org.springframework.stereotype.Component;

@Component
public class TokenUtil {

    private final Encoding encoding;

    public TokenUtil() {
        EncodingRegistry registry = Encodings.newLazyEncodingRegistry();
        encoding = registry.getEncodingForModel("gpt-4").orElseThrow();
    }

    public int getTokenCount(String text) {
        if (text == null || text.isEmpty()) return 0;
        return encoding.countTokens(text);
    }
}
