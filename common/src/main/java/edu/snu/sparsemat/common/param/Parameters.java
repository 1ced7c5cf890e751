/*
 * Copyright (C) 2017 Seoul National University
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.snu.sparsemat.common.param;

import org.apache.reef.tang.annotations.Name;
import org.apache.reef.tang.annotations.NamedParameter;

/**
 * Common parameter classes for matrix computations.
 */
public final class Parameters {
  @NamedParameter(doc = "The number of scratch buffers shared by sparse matrix products. " +
      "It also bounds the number of products running at the same time.",
                  short_name = "num_scratch_buffers",
                  default_value = "10")
  public final class NumScratchBuffers implements Name<Integer> {
  }

  @NamedParameter(doc = "The initial capacity (in elements) of each scratch buffer",
                  short_name = "scratch_buffer_length",
                  default_value = "100")
  public final class ScratchBufferLength implements Name<Integer> {
  }
}
