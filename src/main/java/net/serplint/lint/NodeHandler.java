// Copyright 2026 The Serplint Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.serplint.lint;

import com.google.common.collect.ImmutableList;
import net.serplint.syntax.Node;

/** A NodeHandler analyzes one kind of syntax tree node. */
@FunctionalInterface
interface NodeHandler {

  /**
   * Analyzes a node within the named function and returns the children that the dispatcher
   * should traverse next.
   */
  ImmutableList<Node> handle(Analysis analysis, Node node, String function);
}
