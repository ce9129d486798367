package com.storemock.commerce.infrastructure.persistence.product;

import com.storemock.commerce.domain.product.Product;
import com.storemock.commerce.domain.product.ProductRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemory Product Repository 구현
 * ConcurrentHashMap 기반의 인메모리 카탈로그/재고 저장소 (Infrastructure 계층)
 */
@Repository
public class InMemoryProductRepository implements ProductRepository {

    private final Map<String, Product> products = new ConcurrentHashMap<>();

    public InMemoryProductRepository() {
        initializeData();
    }

    /**
     * 예시 데이터 초기화 (가격 단위: 센트)
     */
    private void initializeData() {
        save(Product.builder().productId("bouquet_roses").title("Bouquet of Red Roses").price(3500).stock(50).build());
        save(Product.builder().productId("bouquet_sunflowers").title("Sunflower Bundle").price(2500).stock(30).build());
        save(Product.builder().productId("orchid_white").title("White Orchid Pot").price(4500).stock(10).build());
        save(Product.builder().productId("vase_glass").title("Glass Vase").price(1200).stock(100).build());
        save(Product.builder().productId("gift_card_50").title("Gift Card $50").price(5000).stock(1000).build());
        save(Product.builder().productId("seasonal_wreath").title("Seasonal Wreath").price(6000).stock(0).build());
    }

    @Override
    public Optional<Product> findById(String productId) {
        return Optional.ofNullable(products.get(productId));
    }

    @Override
    public List<Product> findAll() {
        return new ArrayList<>(products.values());
    }

    @Override
    public Product save(Product product) {
        products.put(product.getProductId(), product);
        return product;
    }
}
