package com.cred.freestyle.catalog.service.store;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.domain.model.PendingPointOfSaleUpdate;
import com.cred.freestyle.catalog.domain.model.PointOfSale;
import com.cred.freestyle.catalog.domain.model.PointOfSaleFields;
import com.cred.freestyle.catalog.domain.model.PointOfSaleRevision;
import com.cred.freestyle.catalog.repository.PendingPointOfSaleUpdateRepository;
import com.cred.freestyle.catalog.repository.PointOfSaleRepository;
import com.cred.freestyle.catalog.repository.PointOfSaleRevisionRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Store for the point of sale family. Point of sale revisions reference container revisions.
 *
 * @author Catalog Team
 */
@Component
public class PointOfSaleStore
        extends RevisionedAggregateStore<PointOfSale, PointOfSaleRevision, PendingPointOfSaleUpdate, PointOfSaleFields> {

    public PointOfSaleStore(
            PointOfSaleRepository pointOfSaleRepository,
            PointOfSaleRevisionRepository pointOfSaleRevisionRepository,
            PendingPointOfSaleUpdateRepository pendingPointOfSaleUpdateRepository
    ) {
        super(CatalogFamily.POINT_OF_SALE, pointOfSaleRepository, pointOfSaleRevisionRepository,
                pendingPointOfSaleUpdateRepository);
    }

    @Override
    protected PointOfSale newBase(String ownerId) {
        return new PointOfSale(ownerId);
    }

    @Override
    protected PointOfSaleRevision newRevision(Long aggregateId, int revision, PointOfSaleFields fields,
                                              List<ChildReference> childReferences) {
        PointOfSaleRevision pointOfSaleRevision = new PointOfSaleRevision();
        pointOfSaleRevision.setAggregateId(aggregateId);
        pointOfSaleRevision.setRevision(revision);
        pointOfSaleRevision.setName(fields.getName());
        pointOfSaleRevision.setUseAuthentication(fields.isUseAuthentication());
        pointOfSaleRevision.setContainerReferences(new ArrayList<>(childReferences));
        return pointOfSaleRevision;
    }

    @Override
    protected PendingPointOfSaleUpdate newDraft(Long aggregateId) {
        return new PendingPointOfSaleUpdate(aggregateId);
    }

    @Override
    protected void writeDraft(PendingPointOfSaleUpdate draft, PointOfSaleFields fields, List<Long> childIds) {
        draft.setName(fields.getName());
        draft.setUseAuthentication(fields.isUseAuthentication());
        draft.getContainerIds().clear();
        draft.getContainerIds().addAll(childIds);
    }

    @Override
    public PointOfSaleFields fieldsOf(PointOfSale base, PointOfSaleRevision revision) {
        return PointOfSaleFields.builder()
                .name(revision.getName())
                .useAuthentication(revision.isUseAuthentication())
                .build();
    }

    @Override
    public PointOfSaleFields fieldsOf(PendingPointOfSaleUpdate draft) {
        return PointOfSaleFields.builder()
                .name(draft.getName())
                .useAuthentication(draft.isUseAuthentication())
                .build();
    }
}
