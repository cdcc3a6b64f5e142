package org.lokray.autopar.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

public class FileUtils
{
	/**
	 * Reads a file as UTF-8 text.
	 */
	public static String load(Path filePath) throws IOException
	{
		return Files.readString(filePath, StandardCharsets.UTF_8);
	}

	/**
	 * Splits text on '\n', keeping each line's terminator ("\n" or "\r\n") attached.
	 * The last element has no terminator when the text does not end with one.
	 * Joining the result gives back the input unchanged.
	 */
	public static List<String> splitLines(String text)
	{
		List<String> lines = new ArrayList<>();
		int start = 0;
		for (int i = 0; i < text.length(); i++)
		{
			if (text.charAt(i) == '\n')
			{
				lines.add(text.substring(start, i + 1));
				start = i + 1;
			}
		}
		if (start < text.length())
		{
			lines.add(text.substring(start));
		}
		return lines;
	}

	/**
	 * Writes the lines to {@code target} so that the target either holds the complete
	 * new content or is left untouched. The content goes to a temporary sibling first
	 * and is then moved over the target; the temporary file never survives a failure.
	 */
	public static void writeAtomically(Path target, List<String> lines) throws IOException
	{
		Path absolute = target.toAbsolutePath();
		Path parent = absolute.getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}

		Path temp = Files.createTempFile(parent, "." + absolute.getFileName(), ".tmp");
		boolean moved = false;
		try
		{
			Files.writeString(temp, String.join("", lines), StandardCharsets.UTF_8);
			try
			{
				Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e)
			{
				Debug.logDebug("Atomic move not supported for " + absolute + ", falling back to replace.");
				Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
			}
			moved = true;
		}
		finally
		{
			if (!moved)
			{
				Files.deleteIfExists(temp);
			}
		}
	}

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}
}
