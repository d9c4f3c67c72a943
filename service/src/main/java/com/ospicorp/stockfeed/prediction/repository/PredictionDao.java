package com.ospicorp.stockfeed.prediction.repository;

import com.ospicorp.stockfeed.prediction.model.Prediction;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class PredictionDao {
  private final JdbcTemplate jdbc;

  public PredictionDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  public List<Prediction> fetchByStockId(long stockId) {
    String sql = """
      SELECT p.id, p.stock_id, p.message_id, p.prediction_type,
             p.target_price, p.target_change_percent, p.period,
             p.recommendation, p.direction, p.justification_text,
             m.text AS message_text, p.predicted_at
      FROM predictions p
      LEFT JOIN messages m ON p.message_id = m.telegram_id
      WHERE p.stock_id = ?
      ORDER BY p.predicted_at DESC, p.id DESC
    """;
    return jdbc.query(sql, (rs, i) -> mapRow(rs), stockId);
  }

  private static Prediction mapRow(ResultSet rs) throws SQLException {
    Timestamp predictedAt = rs.getTimestamp("predicted_at");
    return new Prediction(
        rs.getLong("id"),
        rs.getLong("stock_id"),
        rs.getObject("message_id", Long.class),
        rs.getString("prediction_type"),
        rs.getBigDecimal("target_price"),
        rs.getBigDecimal("target_change_percent"),
        rs.getString("period"),
        rs.getString("recommendation"),
        rs.getString("direction"),
        rs.getString("justification_text"),
        rs.getString("message_text"),
        predictedAt != null ? predictedAt.toInstant() : null);
  }
}
