package com.cred.freestyle.catalog.service.store;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.domain.model.PendingProductUpdate;
import com.cred.freestyle.catalog.domain.model.Product;
import com.cred.freestyle.catalog.domain.model.ProductFields;
import com.cred.freestyle.catalog.domain.model.ProductRevision;
import com.cred.freestyle.catalog.repository.PendingProductUpdateRepository;
import com.cred.freestyle.catalog.repository.ProductRepository;
import com.cred.freestyle.catalog.repository.ProductRevisionRepository;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Store for the product family. Products are leaves and never carry child references.
 *
 * @author Catalog Team
 */
@Component
public class ProductStore extends RevisionedAggregateStore<Product, ProductRevision, PendingProductUpdate, ProductFields> {

    public ProductStore(
            ProductRepository productRepository,
            ProductRevisionRepository productRevisionRepository,
            PendingProductUpdateRepository pendingProductUpdateRepository
    ) {
        super(CatalogFamily.PRODUCT, productRepository, productRevisionRepository, pendingProductUpdateRepository);
    }

    @Override
    protected Product newBase(String ownerId) {
        return new Product(ownerId);
    }

    @Override
    protected ProductRevision newRevision(Long aggregateId, int revision, ProductFields fields,
                                          List<ChildReference> childReferences) {
        if (!childReferences.isEmpty()) {
            throw new IllegalArgumentException("Products cannot reference other aggregates");
        }
        ProductRevision productRevision = new ProductRevision();
        productRevision.setAggregateId(aggregateId);
        productRevision.setRevision(revision);
        productRevision.setName(fields.getName());
        productRevision.setPriceInclVat(fields.getPriceInclVat());
        productRevision.setVatGroupId(fields.getVatGroupId());
        productRevision.setCategoryId(fields.getCategoryId());
        productRevision.setAlcoholPercentage(fields.getAlcoholPercentage());
        productRevision.setFeatured(fields.isFeatured());
        productRevision.setPreferred(fields.isPreferred());
        productRevision.setPriceList(fields.isPriceList());
        return productRevision;
    }

    @Override
    protected PendingProductUpdate newDraft(Long aggregateId) {
        return new PendingProductUpdate(aggregateId);
    }

    @Override
    protected void writeDraft(PendingProductUpdate draft, ProductFields fields, List<Long> childIds) {
        if (!childIds.isEmpty()) {
            throw new IllegalArgumentException("Products cannot reference other aggregates");
        }
        draft.setName(fields.getName());
        draft.setPriceInclVat(fields.getPriceInclVat());
        draft.setVatGroupId(fields.getVatGroupId());
        draft.setCategoryId(fields.getCategoryId());
        draft.setAlcoholPercentage(fields.getAlcoholPercentage());
        draft.setFeatured(fields.isFeatured());
        draft.setPreferred(fields.isPreferred());
        draft.setPriceList(fields.isPriceList());
    }

    @Override
    public ProductFields fieldsOf(Product base, ProductRevision revision) {
        return ProductFields.builder()
                .name(revision.getName())
                .priceInclVat(revision.getPriceInclVat())
                .vatGroupId(revision.getVatGroupId())
                .categoryId(revision.getCategoryId())
                .alcoholPercentage(revision.getAlcoholPercentage())
                .featured(revision.isFeatured())
                .preferred(revision.isPreferred())
                .priceList(revision.isPriceList())
                .build();
    }

    @Override
    public ProductFields fieldsOf(PendingProductUpdate draft) {
        return ProductFields.builder()
                .name(draft.getName())
                .priceInclVat(draft.getPriceInclVat())
                .vatGroupId(draft.getVatGroupId())
                .categoryId(draft.getCategoryId())
                .alcoholPercentage(draft.getAlcoholPercentage())
                .featured(draft.isFeatured())
                .preferred(draft.isPreferred())
                .priceList(draft.isPriceList())
                .build();
    }
}
