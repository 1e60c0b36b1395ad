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

package papyri.lib.plugins;

/**
 * Decides what happens once cancellation has been requested.
 * <p>
 * This is where a user interface would ask for confirmation.
 *
 * @author Papyri developers
 */
@FunctionalInterface
public interface CancellationHandler {

	/**
	 * Possible decisions once cancellation has been requested.
	 */
	enum Decision {
		/**
		 * Stop processing the current image and the rest of the batch.
		 */
		ABORT,
		/**
		 * Ignore the request and continue.
		 */
		RESUME
	}

	/**
	 * Handler that aborts whenever cancellation is requested.
	 * @return
	 */
	static CancellationHandler alwaysAbort() {
		return () -> Decision.ABORT;
	}

	/**
	 * Called whenever a checkpoint finds that cancellation has been requested.
	 * @return the decision
	 */
	Decision onCancellationRequested();

}
