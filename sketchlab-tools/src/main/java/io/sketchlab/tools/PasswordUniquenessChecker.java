package io.sketchlab.tools;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.sketchlab.sketch.BloomFilter;
import io.sketchlab.sketch.MembershipFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Checks candidate passwords against a {@link MembershipFilter} of passwords already in use.
 *
 * <p>Validation runs first and is kept out of the filter: an invalid password is reported and
 * never reaches {@code check}/{@code add}. A valid password the filter has not seen is reported
 * unique and added, so a repeat later in the same batch is reported as already used.
 */
public class PasswordUniquenessChecker
{
  private static final Logger LOG = LoggerFactory.getLogger(PasswordUniquenessChecker.class);

  public static final Predicate<String> NON_EMPTY = password -> password != null && !password.isEmpty();

  private static final int DEFAULT_CAPACITY = 1000;
  private static final int DEFAULT_HASH_COUNT = 3;

  public enum Status
  {
    INVALID("invalid password"),
    ALREADY_USED("already used"),
    UNIQUE("unique");

    private final String description;

    Status(String description)
    {
      this.description = description;
    }

    public String description()
    {
      return description;
    }
  }

  public static final class Result
  {
    private final String password;
    private final Status status;

    Result(String password, Status status)
    {
      this.password = password;
      this.status = status;
    }

    public String password()
    {
      return password;
    }

    public Status status()
    {
      return status;
    }

    @Override
    public String toString()
    {
      return "Password '" + password + "' - " + status.description() + ".";
    }
  }

  private final MembershipFilter filter;
  private final Predicate<String> validator;

  public PasswordUniquenessChecker(MembershipFilter filter)
  {
    this(filter, NON_EMPTY);
  }

  public PasswordUniquenessChecker(MembershipFilter filter, Predicate<String> validator)
  {
    this.filter = Preconditions.checkNotNull(filter, "filter");
    this.validator = Preconditions.checkNotNull(validator, "validator");
  }

  /**
   * @return one result per input, in input order
   */
  public List<Result> check(List<String> passwords)
  {
    ImmutableList.Builder<Result> results = ImmutableList.builderWithExpectedSize(passwords.size());
    for (String password : passwords) {
      results.add(new Result(password, check(password)));
    }
    return results.build();
  }

  public Status check(String password)
  {
    if (!validator.test(password)) {
      LOG.debug("Rejected invalid password [{}]", password);
      return Status.INVALID;
    }
    if (filter.check(password)) {
      return Status.ALREADY_USED;
    }
    filter.add(password);
    return Status.UNIQUE;
  }

  public static void main(String[] args)
  {
    BloomFilter filter = new BloomFilter(DEFAULT_CAPACITY, DEFAULT_HASH_COUNT);
    for (String existing : Arrays.asList("password123", "admin123", "qwerty123")) {
      filter.add(existing);
    }

    List<String> candidates = args.length > 0
                              ? Arrays.asList(args)
                              : Arrays.asList("password123", "newpassword", "admin123", "guest");

    PasswordUniquenessChecker checker = new PasswordUniquenessChecker(filter);
    for (Result result : checker.check(candidates)) {
      System.out.println(result);
    }
    LOG.info("Filter fill: expected false positive rate [{}]", filter.expectedFpp());
  }
}
