package com.osint.correlation.correlation;

import com.osint.correlation.core.model.Observation;
import com.osint.correlation.similarity.TextNormalizer;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Default blocking keys:
 * <ul>
 *   <li><b>Username prefix</b>: first 3 characters of the normalised handle (e.g. {@code usr:joh})</li>
 *   <li><b>Email domain</b>: domain of the email attribute or queried address (e.g. {@code dom:example.com})</li>
 * </ul>
 */
public class ObservationBlockingKeyStrategy implements BlockingKeyStrategy {

    static final int PREFIX_LENGTH = 3;

    @Override
    public Set<String> generateKeys(Observation observation) {
        Set<String> keys = new LinkedHashSet<>();

        String username = observation.attributeAsString("username");
        if (username == null && !observation.queryValue().contains("@")) {
            username = observation.queryValue();
        }
        String handle = TextNormalizer.normalizeHandle(username);
        if (!handle.isEmpty()) {
            keys.add("usr:" + handle.substring(0, Math.min(PREFIX_LENGTH, handle.length())));
        }

        addEmailKeys(keys, observation.attributeAsString("email"));
        addEmailKeys(keys, observation.queryValue());
        return keys;
    }

    private static void addEmailKeys(Set<String> keys, String value) {
        String email = TextNormalizer.normalizeEmail(value);
        if (email == null) {
            return;
        }
        keys.add("dom:" + TextNormalizer.emailDomain(email).toLowerCase(Locale.ROOT));
        String local = TextNormalizer.normalizeHandle(TextNormalizer.emailLocalPart(email));
        if (!local.isEmpty()) {
            keys.add("usr:" + local.substring(0, Math.min(PREFIX_LENGTH, local.length())));
        }
    }
}
