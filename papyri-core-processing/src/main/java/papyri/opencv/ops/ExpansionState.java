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

package papyri.opencv.ops;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import papyri.lib.images.OutputSet;

/**
 * Immutable state threaded through the expansion of variants for one image.
 * <p>
 * Each step returns a new state with the next generation index, the accumulated outputs,
 * any status messages and whether processing should stop.
 *
 * @author Papyri developers
 */
public class ExpansionState {

	private final int nextIndex;
	private final OutputSet outputs;
	private final List<String> statuses;
	private final boolean stopped;

	private ExpansionState(int nextIndex, OutputSet outputs, List<String> statuses, boolean stopped) {
		this.nextIndex = nextIndex;
		this.outputs = outputs;
		this.statuses = Collections.unmodifiableList(statuses);
		this.stopped = stopped;
	}

	/**
	 * Initial state, with the first index 1.
	 * @param retainImages if true, images are kept in the output set; otherwise only labels and indices are recorded
	 * @return
	 */
	public static ExpansionState initial(boolean retainImages) {
		return new ExpansionState(1, retainImages ? OutputSet.empty() : OutputSet.storageOnly(), List.of(), false);
	}

	/**
	 * Get a state with an additional output, using the next index.
	 * @param label display label
	 * @param image
	 * @return
	 */
	public ExpansionState withOutput(String label, BufferedImage image) {
		return new ExpansionState(nextIndex + 1, outputs.plus(label, nextIndex, image), new ArrayList<>(statuses), stopped);
	}

	/**
	 * Get a state with an additional status message. Repeated messages are only recorded once.
	 * @param status
	 * @return
	 */
	public ExpansionState withStatus(String status) {
		if (statuses.contains(status))
			return this;
		var list = new ArrayList<>(statuses);
		list.add(status);
		return new ExpansionState(nextIndex, outputs, list, stopped);
	}

	/**
	 * Get a state that signals processing should stop.
	 * @return
	 */
	public ExpansionState stop() {
		if (stopped)
			return this;
		return new ExpansionState(nextIndex, outputs, new ArrayList<>(statuses), true);
	}

	/**
	 * Index that will be given to the next output.
	 * @return
	 */
	public int getNextIndex() {
		return nextIndex;
	}

	/**
	 * Outputs accumulated so far.
	 * @return
	 */
	public OutputSet getOutputSet() {
		return outputs;
	}

	/**
	 * Status messages, in the order they were first recorded.
	 * @return
	 */
	public List<String> getStatuses() {
		return statuses;
	}

	/**
	 * Returns true if processing should stop.
	 * @return
	 */
	public boolean isStopped() {
		return stopped;
	}

	@Override
	public String toString() {
		return "ExpansionState [nextIndex=" + nextIndex + ", outputs=" + outputs.size() + ", stopped=" + stopped + "]";
	}

}
