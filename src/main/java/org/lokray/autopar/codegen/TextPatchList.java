package org.lokray.autopar.codegen;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.lokray.autopar.dto.PatchDTO;
import org.lokray.autopar.dto.PatchListDTO;
import org.lokray.autopar.util.Debug;
import org.lokray.autopar.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain text substitutions applied to the rewritten source after all directives are in.
 * They are cosmetic and take no part in the loop analysis. A list is
 * read from a JSON file such as:
 * <pre>
 * {
 *   "name": "benchmark-title",
 *   "patches": [
 *     { "find": "Sequential run", "replaceWith": "Parallel run" }
 *   ]
 * }
 * </pre>
 */
public class TextPatchList
{
	private final String name;
	private final List<PatchDTO> patches;

	private TextPatchList(String name, List<PatchDTO> patches)
	{
		this.name = name;
		this.patches = List.copyOf(patches);
	}

	public static TextPatchList empty()
	{
		return new TextPatchList("none", List.of());
	}

	public static TextPatchList load(Path file) throws IOException
	{
		PatchListDTO dto;
		try
		{
			dto = new Gson().fromJson(FileUtils.load(file), PatchListDTO.class);
		}
		catch (JsonParseException e)
		{
			throw new IllegalArgumentException("Malformed patch list " + file + ": " + e.getMessage(), e);
		}
		if (dto == null || dto.patches == null)
		{
			throw new IllegalArgumentException("Patch list " + file + " has no 'patches' array");
		}

		for (int i = 0; i < dto.patches.size(); i++)
		{
			PatchDTO patch = dto.patches.get(i);
			if (patch == null)
			{
				throw new IllegalArgumentException("Patch #" + (i + 1) + " in " + file + " is null");
			}
			if (patch.whenLineContains == null)
			{
				patch.whenLineContains = new ArrayList<>();
			}
			if (patch.find == null && patch.whenLineContains.isEmpty())
			{
				throw new IllegalArgumentException("Patch #" + (i + 1) + " in " + file + " matches nothing: set 'find' or 'whenLineContains'");
			}
			if (patch.find != null && patch.replaceWith == null && patch.insertAfter == null)
			{
				throw new IllegalArgumentException("Patch #" + (i + 1) + " in " + file + " has 'find' but neither 'replaceWith' nor 'insertAfter'");
			}
		}

		String name = dto.name != null ? dto.name : file.getFileName().toString();
		Debug.logDebug("Loaded " + dto.patches.size() + " text patch(es) from " + file);
		return new TextPatchList(name, dto.patches);
	}

	public String getName()
	{
		return name;
	}

	public int size()
	{
		return patches.size();
	}

	public List<String> applyTo(List<String> lines, String lineSeparator)
	{
		List<String> output = new ArrayList<>(lines);
		for (PatchDTO patch : patches)
		{
			for (int i = 0; i < output.size(); i++)
			{
				String line = output.get(i);
				if (!matches(patch, line))
				{
					continue;
				}
				Debug.logDebug("Patch '" + describe(patch) + "' applies to output line " + (i + 1));

				if (patch.find != null && patch.replaceWith != null)
				{
					line = line.replace(patch.find, patch.replaceWith);
					output.set(i, line);
				}
				if (patch.insertAfter != null)
				{
					if (!line.endsWith("\n"))
					{
						output.set(i, line + lineSeparator);
					}
					output.add(i + 1, patch.insertAfter + lineSeparator);
					i++;
				}

				if (patch.stopAfterFirst)
				{
					break;
				}
			}
		}
		return output;
	}

	private static boolean matches(PatchDTO patch, String line)
	{
		for (String required : patch.whenLineContains)
		{
			if (!line.contains(required))
			{
				return false;
			}
		}
		return patch.find == null || line.contains(patch.find);
	}

	private static String describe(PatchDTO patch)
	{
		return patch.description != null ? patch.description : String.valueOf(patch.find);
	}
}
