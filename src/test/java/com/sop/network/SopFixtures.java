package com.sop.network;

import com.sop.network.build.GraphBuilder;
import com.sop.network.core.model.Node;
import com.sop.network.core.model.NodeKind;
import com.sop.network.core.model.WorldNetwork;
import com.sop.network.parse.StructuralParser;

import java.util.List;

/**
 * Procedure texts shared by the tests.
 */
public final class SopFixtures {

    /** Minimal single-category document. */
    public static final String AMAZON = """
            ### **Amazon Claims**
            1. Is the provider Vita Health?
             - Yes: Assign ID ABC123DEF and process.
             - No: Continue to the next step.
            2. Refer to PR.OP.CL.2862.""";

    /** Full document: header, revisions, two categories, nested conditions and a clinic table. */
    public static final String DUPLICATE_CLAIMS = """
            # **Duplicate Claims Handling**

            **Document Type:** Procedure **Document Number:** PR.OP.CL.1000

            **Status:** Active

            **Cause/Explanation:** Claims pend when a possible duplicate
            is detected by the system.

            **Pend Code:** D12

            | Revision | Date | Description |
            |---|---|---|
            |2.0|03/01/2024|Added Amazon claims section|
            |1.0|01/15/2023|Initial release|

            ## Background
            See PR.OP.CL.3000 - Pend Basics for background.

            ## Action Required

            ### Overview
            This section lists the claim types below.

            ### **Amazon Claims**
            1. Is the provider Vita Health?
             - Yes: Assign ID ABC123DEF and process.
             - No: Continue to the next step.
            2. Refer to PR.OP.CL.2862.

            ### **Care Medical Claims**
            1. Does the claim carry TIN 123456789?
             - **Yes:** Proceed to the Amazon Claims section.
             - **No:** Deny the claim.
               I Yes: Send letter per PR.OP.CL.2862 - Letters.
               I No: Close the claim.
               - **Provider-submitted:** Pend to D12 and route.
            **Important Note: Always check the group number 1234567.**
            2. Finish the claim.

            ## Clinic Directory

            **Care Medical Clinics**

            | Clinic | TIN | Provider ID | NPI |
            |---|---|---|---|
            | Care Medical Idaho | 123-45-6789 | CMI0001AB | 1234567890 |
            | Care Medical Oregon | 987654321 | CMO0002AB | 0987654321 |
            """;

    /** Referenced letters procedure; refers on to PR.OP.CL.4000 and names itself in its header. */
    public static final String LETTERS = """
            # **Duplicate Letters**

            **Document Type:** Procedure **Document Number:** PR.OP.CL.2862

            |1.1|02/02/2024|Clarified letters|

            ### **Letter Claims**
            1. Send the letter.
            2. Check PR.OP.CL.4000 - Appeals.
            """;

    /** Appeals procedure, a leaf. */
    public static final String APPEALS = """
            # **Appeals**

            ### **Appeal Claims**
            1. File the appeal.
            """;

    /** Two documents that refer to each other. */
    public static final String CYCLE_A = """
            # **Cycle A**

            ### **A Claims**
            1. Refer to PR.OP.CL.2000.
            """;

    public static final String CYCLE_B = """
            # **Cycle B**

            ### **B Claims**
            1. Refer back to PR.OP.CL.1000.
            """;

    private SopFixtures() {
    }

    public static WorldNetwork build(String text, String documentKey) {
        return new GraphBuilder().build(new StructuralParser().parse(text), documentKey);
    }

    public static List<Node> nodesOfKind(WorldNetwork network, NodeKind kind) {
        return network.getNodes().stream().filter(n -> n.getKind() == kind).toList();
    }

    public static Node onlyNode(WorldNetwork network, NodeKind kind, String content) {
        List<Node> matches = network.getNodes().stream()
                .filter(n -> n.getKind() == kind && n.getContent().equals(content))
                .toList();
        if (matches.size() != 1) {
            throw new AssertionError("Expected one " + kind + " node '" + content + "' but found " + matches.size());
        }
        return matches.get(0);
    }
}
