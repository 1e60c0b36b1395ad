/*-
 * #%L
 * This file is part of Papyri.
 * %%
 * Copyright (C) 2023 - 2024 Papyri developers
 * %%
 * Papyri is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Papyri is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Papyri.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package papyri.lib.batch;

import java.util.List;
import java.util.Optional;

import papyri.lib.images.OutputSet;

/**
 * The result of running a batch.
 *
 * @author Papyri developers
 */
public class BatchResult {

	private final OutputSet firstOutputSet;
	private final boolean firstGrayscale;
	private final List<ImageSummary> summaries;
	private final List<UnreadableImage> unreadable;
	private final List<String> statuses;
	private final boolean aborted;

	BatchResult(OutputSet firstOutputSet, boolean firstGrayscale, List<ImageSummary> summaries,
			List<UnreadableImage> unreadable, List<String> statuses, boolean aborted) {
		this.firstOutputSet = firstOutputSet;
		this.firstGrayscale = firstGrayscale;
		this.summaries = List.copyOf(summaries);
		this.unreadable = List.copyOf(unreadable);
		this.statuses = List.copyOf(statuses);
		this.aborted = aborted;
	}

	/**
	 * Outputs of the first image that could be read, including the original if any variant was generated.
	 * @return
	 */
	public Optional<OutputSet> getFirstOutputSet() {
		return Optional.ofNullable(firstOutputSet);
	}

	/**
	 * Returns true if the first image that could be read is grayscale.
	 * @return
	 */
	public boolean isFirstImageGrayscale() {
		return firstGrayscale;
	}

	/**
	 * Returns true if at least one variant was generated for the first image that could be read.
	 * @return
	 */
	public boolean isFirstImageProcessed() {
		return firstOutputSet != null && firstOutputSet.size() > 1;
	}

	/**
	 * Summaries of the images that were read, in batch order.
	 * @return
	 */
	public List<ImageSummary> getSummaries() {
		return summaries;
	}

	/**
	 * Images that could not be read, in batch order.
	 * @return
	 */
	public List<UnreadableImage> getUnreadableImages() {
		return unreadable;
	}

	/**
	 * Status messages for the user.
	 * @return
	 */
	public List<String> getStatuses() {
		return statuses;
	}

	/**
	 * Status messages joined into a single message.
	 * @return
	 */
	public String getStatusMessage() {
		return String.join(" ", statuses);
	}

	/**
	 * Returns true if the batch was cancelled before all images were processed.
	 * @return
	 */
	public boolean isAborted() {
		return aborted;
	}

	@Override
	public String toString() {
		return "BatchResult [images=" + summaries.size() + ", unreadable=" + unreadable.size() + ", aborted=" + aborted + "]";
	}

}
