package com.labvault.lims.service;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class JdbcSpecimenResolver implements SpecimenResolver {
    private final NamedParameterJdbcTemplate jdbc;

    public JdbcSpecimenResolver(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Long> findSpecimenIdByWuid(int wuid) {
        List<Long> ids = jdbc.queryForList(
                "select id from specimens where specimen_number = :wuid",
                new MapSqlParameterSource("wuid", wuid),
                Long.class);
        return ids.stream().findFirst();
    }
}
