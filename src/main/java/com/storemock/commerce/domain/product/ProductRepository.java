package com.storemock.commerce.domain.product;

import java.util.List;
import java.util.Optional;

/**
 * ProductRepository - Product 도메인의 저장소 인터페이스 (Port)
 *
 * 구현체: infrastructure.persistence.product.InMemoryProductRepository
 */
public interface ProductRepository {

    Optional<Product> findById(String productId);

    List<Product> findAll();

    Product save(Product product);
}
