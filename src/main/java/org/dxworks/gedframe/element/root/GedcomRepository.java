package org.dxworks.gedframe.element.root;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.model.RepositoryData;

// TODO: derive NAME and ADDR once repositories are exported with fields
public class GedcomRepository extends GedcomRecord<RepositoryData> {

    public GedcomRepository(GedcomElement element) {
        super(element);
    }

    @Override
    public RepositoryData getData() {
        return new RepositoryData();
    }
}
