package com.dbdoctor.application.healthcheck;

import com.dbdoctor.domain.schema.CtrlRole;
import com.dbdoctor.domain.schema.SchemaCatalog;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Same rule as {@link TcaTablesLanguageLessThanOneHasZeroLanguageParent} for the translation
 * source field. Tables without a translation source field are not checked.
 */
@Component
public class TcaTablesLanguageLessThanOneHasZeroLanguageSource extends AbstractDefaultLanguageFieldCheck {

    public TcaTablesLanguageLessThanOneHasZeroLanguageSource(HealthCheckSupport support, SchemaCatalog catalog) {
        super(support, catalog, CtrlRole.TRANSLATION_SOURCE);
    }

    @Override
    protected String title() {
        return "Check default language records with translation source";
    }

    @Override
    protected List<String> description() {
        return List.of(
            "Records with language 0 (default) or -1 (all languages) have not been translated",
            "from another record, their translation source field must be 0. This health check",
            "finds records where it is not and sets it to 0."
        );
    }

    @Override
    protected String findingsLabel() {
        return "default language records with a translation source";
    }
}
