package com.cred.freestyle.catalog.service.store;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.domain.model.Container;
import com.cred.freestyle.catalog.domain.model.ContainerFields;
import com.cred.freestyle.catalog.domain.model.ContainerRevision;
import com.cred.freestyle.catalog.domain.model.PendingContainerUpdate;
import com.cred.freestyle.catalog.repository.ContainerRepository;
import com.cred.freestyle.catalog.repository.ContainerRevisionRepository;
import com.cred.freestyle.catalog.repository.PendingContainerUpdateRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Store for the container family. Container revisions reference product revisions.
 *
 * @author Catalog Team
 */
@Component
public class ContainerStore extends RevisionedAggregateStore<Container, ContainerRevision, PendingContainerUpdate, ContainerFields> {

    public ContainerStore(
            ContainerRepository containerRepository,
            ContainerRevisionRepository containerRevisionRepository,
            PendingContainerUpdateRepository pendingContainerUpdateRepository
    ) {
        super(CatalogFamily.CONTAINER, containerRepository, containerRevisionRepository, pendingContainerUpdateRepository);
    }

    @Override
    protected Container newBase(String ownerId) {
        return new Container(ownerId);
    }

    @Override
    protected ContainerRevision newRevision(Long aggregateId, int revision, ContainerFields fields,
                                            List<ChildReference> childReferences) {
        ContainerRevision containerRevision = new ContainerRevision();
        containerRevision.setAggregateId(aggregateId);
        containerRevision.setRevision(revision);
        containerRevision.setName(fields.getName());
        containerRevision.setProductReferences(new ArrayList<>(childReferences));
        return containerRevision;
    }

    @Override
    protected PendingContainerUpdate newDraft(Long aggregateId) {
        return new PendingContainerUpdate(aggregateId);
    }

    @Override
    protected void writeDraft(PendingContainerUpdate draft, ContainerFields fields, List<Long> childIds) {
        draft.setName(fields.getName());
        draft.setPublicContainer(fields.isPublicContainer());
        draft.getProductIds().clear();
        draft.getProductIds().addAll(childIds);
    }

    @Override
    public void applyToBase(Container base, ContainerFields fields) {
        base.setPublicContainer(fields.isPublicContainer());
    }

    @Override
    public ContainerFields fieldsOf(Container base, ContainerRevision revision) {
        return ContainerFields.builder()
                .name(revision.getName())
                .publicContainer(base.isPublicContainer())
                .build();
    }

    @Override
    public ContainerFields fieldsOf(PendingContainerUpdate draft) {
        return ContainerFields.builder()
                .name(draft.getName())
                .publicContainer(draft.isPublicContainer())
                .build();
    }
}
