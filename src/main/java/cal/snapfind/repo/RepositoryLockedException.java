package cal.snapfind.repo;

import java.io.IOException;

/**
 * Another process holds an exclusive lock on the repository.
 */
public class RepositoryLockedException extends IOException {

  private final RepositoryLock.Info holder;

  public RepositoryLockedException(RepositoryLock.Info holder) {
    super("repository is already locked exclusively by PID " + holder.pid()
        + " on " + holder.hostname() + " by " + holder.username()
        + " since " + holder.time());
    this.holder = holder;
  }

  public RepositoryLock.Info holder() {
    return holder;
  }

}
