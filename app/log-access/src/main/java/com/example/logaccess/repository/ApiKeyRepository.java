package com.example.logaccess.repository;

import com.example.logaccess.model.ApiKeyRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class ApiKeyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ApiKeyRecord> findByUserKey(String userKey) {
    final String sql =
        """
        SELECT userkey, login
        FROM users_log_api
        WHERE userkey = :userKey
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userKey", userKey);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private ApiKeyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ApiKeyRecord(rs.getString("userkey"), rs.getString("login"));
  }
}
