package io.podsim.tools.cmsh;

import java.util.Objects;

/**
 * Position of a cmsh session. Immutable; every transition produces a new state.
 *
 * @param user login user shown in the prompt
 * @param headnode head node shown in the prompt
 * @param mode current mode
 * @param selected object chosen with {@code use}, or null
 */
public record CmshState(String user, String headnode, CmshMode mode, String selected) {

  public CmshState {
    Objects.requireNonNull(mode, "mode");
  }

  public static CmshState root(String headnode) {
    return new CmshState("root", headnode, CmshMode.ROOT, null);
  }

  public CmshState enter(CmshMode newMode) {
    return new CmshState(user, headnode, newMode, null);
  }

  public CmshState select(String object) {
    return new CmshState(user, headnode, mode, object);
  }

  public boolean hasSelection() {
    return selected != null;
  }

  /** {@code [root@head]% }, {@code [root@head->device]% } or {@code [root@head->device[obj]]% }. */
  public String prompt() {
    StringBuilder sb = new StringBuilder("[").append(user).append('@').append(headnode);
    if (mode != CmshMode.ROOT) {
      sb.append("->").append(mode.keyword());
      if (selected != null) {
        sb.append('[').append(selected).append(']');
      }
    }
    return sb.append("]% ").toString();
  }
}
