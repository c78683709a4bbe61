package com.dbdoctor.adapter.out.persistence;

import com.dbdoctor.application.port.out.TableProbe;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.util.Locale;

@Component
public class JdbcTableProbe implements TableProbe {

    private final DataSource dataSource;

    public JdbcTableProbe(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean exists(String table) {
        try {
            return JdbcUtils.extractDatabaseMetaData(dataSource, metaData -> {
                String name = table;
                if (metaData.storesUpperCaseIdentifiers()) {
                    name = table.toUpperCase(Locale.ROOT);
                } else if (metaData.storesLowerCaseIdentifiers()) {
                    name = table.toLowerCase(Locale.ROOT);
                }
                String escape = metaData.getSearchStringEscape();
                if (escape != null && !escape.isEmpty()) {
                    name = name.replace("_", escape + "_").replace("%", escape + "%");
                }
                // Table type names differ between drivers, any relation with that name counts
                try (ResultSet tables = metaData.getTables(null, null, name, null)) {
                    return tables.next();
                }
            });
        } catch (MetaDataAccessException e) {
            throw new DataAccessResourceFailureException("Could not look up table \"" + table + "\"", e);
        }
    }
}
