package org.dxworks.gedframe.export;

import org.approvaltests.Approvals;
import org.dxworks.gedframe.TestUtils;
import org.dxworks.gedframe.parser.GedcomParser;
import org.junit.jupiter.api.Test;

public class JsonExportApprovalTest {

    @Test
    void export_SimpleFamily() {
        verify("01_simple_family_record.ged", true);
    }

    @Test
    void export_SimpleFamily_WithoutEmptyFields() {
        verify("01_simple_family_record.ged", false);
    }

    @Test
    void export_FullRecordSet() {
        verify("05_full_record_set.ged", true);
    }

    private static void verify(String fileName, boolean emptyFields) {
        GedcomParser parser = TestUtils.parsedSample(fileName);
        Approvals.verify(parser.export("json", emptyFields));
    }
}
