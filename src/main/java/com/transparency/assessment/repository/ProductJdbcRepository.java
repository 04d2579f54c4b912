package com.transparency.assessment.repository;

import com.transparency.assessment.domain.DomainModels.Product;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ProductJdbcRepository {
    private static final RowMapper<Product> PRODUCT = (rs, n) -> new Product(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5),
            Instant.parse(rs.getString(6)));

    private final JdbcTemplate jdbcTemplate;

    public ProductJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean exists(String productKey) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM products WHERE product_key = ?", Long.class, productKey);
        return count != null && count > 0;
    }

    public void insert(Product p) {
        jdbcTemplate.update(
                "INSERT INTO products(product_key, company_name, product_name, description, domain, created_at) VALUES (?,?,?,?,?,?)",
                p.productKey(), p.companyName(), p.productName(), p.description(), p.domain(), p.createdAt().toString());
    }

    public Optional<Product> find(String productKey) {
        return jdbcTemplate.query(
                "SELECT product_key, company_name, product_name, description, domain, created_at FROM products WHERE product_key = ?",
                PRODUCT, productKey).stream().findFirst();
    }

    public List<Product> findAll() {
        return jdbcTemplate.query(
                "SELECT product_key, company_name, product_name, description, domain, created_at FROM products ORDER BY created_at, product_key",
                PRODUCT);
    }
}
