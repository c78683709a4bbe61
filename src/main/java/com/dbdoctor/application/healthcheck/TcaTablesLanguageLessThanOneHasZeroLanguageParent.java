package com.dbdoctor.application.healthcheck;

import com.dbdoctor.domain.schema.CtrlRole;
import com.dbdoctor.domain.schema.SchemaCatalog;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Default language and all-language records must not point to a translation parent.
 */
@Component
public class TcaTablesLanguageLessThanOneHasZeroLanguageParent extends AbstractDefaultLanguageFieldCheck {

    public TcaTablesLanguageLessThanOneHasZeroLanguageParent(HealthCheckSupport support, SchemaCatalog catalog) {
        super(support, catalog, CtrlRole.TRANSLATION_PARENT);
    }

    @Override
    protected String title() {
        return "Check default language records with translation parent";
    }

    @Override
    protected List<String> description() {
        return List.of(
            "Records with language 0 (default) or -1 (all languages) are not translations and",
            "must not point to a translation parent. This health check finds records in all",
            "language aware tables where the translation parent field is not 0 and sets it to 0."
        );
    }

    @Override
    protected String findingsLabel() {
        return "default language records with a translation parent";
    }
}
