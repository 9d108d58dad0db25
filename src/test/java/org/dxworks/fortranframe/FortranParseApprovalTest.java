package org.dxworks.fortranframe;

import org.approvaltests.Approvals;
import org.dxworks.fortranframe.export.TreeTextDumper;
import org.dxworks.fortranframe.model.Node;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

public class FortranParseApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/fortran/";

    @Test
    void parse_HeatModule() throws Exception {
        verify("heat.f90", FortranframeConfig.defaults());
    }

    @Test
    void parse_LegacyFixedForm() throws Exception {
        verify("legacy.f", FortranframeConfig.defaults());
    }

    @Test
    void parse_HeatModule_PrunedStep() throws Exception {
        FortranframeConfig config = FortranframeConfig.with(null,
                List.of("module:heat", "subroutine:step"),
                true, true, List.of("u\\(i\\)"), List.of());
        verify("heat.f90", config);
    }

    private static void verify(String fileName, FortranframeConfig config) throws Exception {
        Node root = App.parseFile(Paths.get(SAMPLES_BASE_PATH + fileName), config, TestUtils.quietLogger());
        Node selected = root.find(config.getSelectPath()).orElseThrow();
        Approvals.verify(TreeTextDumper.dump(selected));
    }
}
