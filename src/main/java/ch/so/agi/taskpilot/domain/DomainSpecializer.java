package ch.so.agi.taskpilot.domain;

import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class DomainSpecializer {

    private static final Logger log = LoggerFactory.getLogger(DomainSpecializer.class);

    private final DomainCatalog catalog;

    public DomainSpecializer(DomainCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Detects the first domain, in catalog order, whose keywords occur in the text. An empty result means
     * the request is not specialized.
     */
    public Optional<DomainProfile> detect(String text) {
        if (!StringUtils.hasText(text)) {
            return Optional.empty();
        }
        String lowerCaseText = text.toLowerCase(Locale.ROOT);
        for (DomainDefinition domain : catalog.domains()) {
            Optional<String> keyword = domain.firstMatchingKeyword(lowerCaseText);
            if (keyword.isPresent()) {
                log.info("Detected domain {} via keyword '{}'", domain.name(), keyword.get());
                return Optional.of(DomainProfile.of(domain, keyword.get()));
            }
        }
        return Optional.empty();
    }
}
