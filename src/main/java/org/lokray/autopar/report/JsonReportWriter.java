package org.lokray.autopar.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.autopar.ParallelizationResult;
import org.lokray.autopar.analysis.LoopRecord;
import org.lokray.autopar.analysis.Reduction;
import org.lokray.autopar.codegen.LoopDirective;
import org.lokray.autopar.dto.LoopDTO;
import org.lokray.autopar.dto.ReportDTO;
import org.lokray.autopar.util.Debug;
import org.lokray.autopar.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the run summary as JSON.
 */
public class JsonReportWriter
{
	private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

	public ReportDTO toDTO(Path inputFile, Path outputFile, ParallelizationResult result)
	{
		ReportDTO report = new ReportDTO();
		report.inputFile = inputFile.toString();
		report.outputFile = outputFile != null ? outputFile.toString() : null;
		report.totalLoops = result.loops().size();
		report.parallelizedLoops = (int) result.parallelizedCount();
		report.warnings.addAll(result.warnings());

		List<LoopRecord> loops = result.loops();
		for (int i = 0; i < loops.size(); i++)
		{
			LoopRecord loop = loops.get(i);
			LoopDTO dto = new LoopDTO();
			dto.index = i + 1;
			dto.functionName = loop.functionName();
			dto.startLine = loop.startLine() + 1;
			dto.endLine = loop.endLine() + 1;
			dto.loopVariable = loop.loopVariable();
			dto.parallelizable = loop.parallelizable();
			dto.alreadyAnnotated = loop.alreadyAnnotated();
			dto.directive = result.directives().stream()
					.filter(d -> d.loop().equals(loop))
					.map(LoopDirective::directive)
					.map(String::strip)
					.findFirst()
					.orElse(null);
			for (Reduction reduction : loop.reductionVariables())
			{
				dto.reductions.add(reduction.operator() + ":" + reduction.variable());
			}
			dto.findings.addAll(loop.findings());
			report.loops.add(dto);
		}
		return report;
	}

	public String toJson(ReportDTO report)
	{
		return gson.toJson(report);
	}

	public void write(Path target, Path inputFile, Path outputFile, ParallelizationResult result) throws IOException
	{
		String json = toJson(toDTO(inputFile, outputFile, result));
		FileUtils.writeAtomically(target, List.of(json + "\n"));
		Debug.logInfo("Wrote JSON report to: " + target);
	}
}
