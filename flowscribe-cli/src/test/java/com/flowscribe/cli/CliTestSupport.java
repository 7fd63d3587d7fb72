package com.flowscribe.cli;

import com.flowscribe.FlowScribeCLI;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the CLI in-process and captures standard output.
 */
final class CliTestSupport {

    static final String LINEAR_FLOWCHART = """
        <?xml version="1.0" encoding="UTF-8"?>
        <graphml xmlns="http://graphml.graphdrawing.org/xmlns" xmlns:y="http://www.yworks.com/xml/graphml">
          <graph id="G" edgedefault="directed">
            <node id="n1"><data key="d6"><y:ShapeNode><y:NodeLabel>Start</y:NodeLabel><y:Shape type="ellipse"/></y:ShapeNode></data></node>
            <node id="n2"><data key="d6"><y:ShapeNode><y:NodeLabel>Input Value</y:NodeLabel><y:Shape type="parallelogram"/></y:ShapeNode></data></node>
            <node id="n3"><data key="d6"><y:ShapeNode><y:NodeLabel>Print Result</y:NodeLabel><y:Shape type="parallelogram"/></y:ShapeNode></data></node>
            <node id="n4"><data key="d6"><y:ShapeNode><y:NodeLabel>End</y:NodeLabel><y:Shape type="ellipse"/></y:ShapeNode></data></node>
            <edge id="e1" source="n1" target="n2"/>
            <edge id="e2" source="n2" target="n3"/>
            <edge id="e3" source="n3" target="n4"/>
          </graph>
        </graphml>
        """;

    static final String UML_CLASS = """
        <?xml version="1.0" encoding="UTF-8"?>
        <graphml xmlns="http://graphml.graphdrawing.org/xmlns" xmlns:y="http://www.yworks.com/xml/graphml">
          <graph id="G" edgedefault="directed">
            <node id="c1"><data key="d6"><y:ShapeNode><y:NodeLabel>UserAccount { id: int, name: str }</y:NodeLabel><y:Shape type="roundrectangle"/></y:ShapeNode></data></node>
          </graph>
        </graphml>
        """;

    private CliTestSupport() {
    }

    static Path writeDiagram(Path directory, String fileName) throws IOException {
        return writeDiagram(directory, fileName, LINEAR_FLOWCHART);
    }

    static Path writeDiagram(Path directory, String fileName, String graphml) throws IOException {
        Path file = directory.resolve(fileName);
        Files.createDirectories(file.getParent());
        Files.writeString(file, graphml);
        return file;
    }

    static Result run(String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            int exitCode = FlowScribeCLI.createCommandLine().execute(args);
            return new Result(exitCode, captured.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
        }
    }

    record Result(int exitCode, String output) {
    }
}
