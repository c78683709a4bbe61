package com.dbdoctor.infrastructure.config;

import com.dbdoctor.adapter.out.catalog.JsonSchemaCatalogLoader;
import com.dbdoctor.application.healthcheck.DanglingWorkspaceRecords;
import com.dbdoctor.application.healthcheck.HealthCheckRegistry;
import com.dbdoctor.application.healthcheck.PagesBrokenTree;
import com.dbdoctor.application.healthcheck.SysFileReferenceInvalidPid;
import com.dbdoctor.application.healthcheck.TcaTablesLanguageLessThanOneHasZeroLanguageParent;
import com.dbdoctor.application.healthcheck.TcaTablesLanguageLessThanOneHasZeroLanguageSource;
import com.dbdoctor.application.healthcheck.TcaTablesPidMissing;
import com.dbdoctor.application.healthcheck.TcaTablesTranslatedLanguageParentMissing;
import com.dbdoctor.domain.schema.SchemaCatalog;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class HealthCheckConfig {

    @Bean
    public SchemaCatalog schemaCatalog(JsonSchemaCatalogLoader loader, DbDoctorProperties properties) {
        return loader.load(properties.getCatalogLocation());
    }

    /**
     * Registration order is run order. Tree and pid checks come first so later checks do not
     * report records that are about to be removed anyway.
     */
    @Bean
    public HealthCheckRegistry healthCheckRegistry(
            DanglingWorkspaceRecords danglingWorkspaceRecords,
            PagesBrokenTree pagesBrokenTree,
            SysFileReferenceInvalidPid sysFileReferenceInvalidPid,
            TcaTablesPidMissing tcaTablesPidMissing,
            TcaTablesLanguageLessThanOneHasZeroLanguageParent languageParent,
            TcaTablesLanguageLessThanOneHasZeroLanguageSource languageSource,
            TcaTablesTranslatedLanguageParentMissing translatedLanguageParentMissing) {
        return new HealthCheckRegistry(List.of(
            danglingWorkspaceRecords,
            pagesBrokenTree,
            sysFileReferenceInvalidPid,
            tcaTablesPidMissing,
            languageParent,
            languageSource,
            translatedLanguageParentMissing
        ));
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
